package com.appointment.scheduler.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "appointment",
        uniqueConstraints = {
            @UniqueConstraint(name = Appointment.SLOT_KEY_CONSTRAINT, columnNames = {"slot_key"})
        },
        indexes = {
            @Index(name = "idx_appointment_start_time", columnList = "start_time"),
            @Index(name = "idx_appointment_email", columnList = "email")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public static final String SLOT_KEY_CONSTRAINT = "uk_appointment_slot_key";

    public enum Status { ACTIVE, CANCELLED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    /**
     * Mirrors startTime while ACTIVE, NULL once cancelled. The unique constraint
     * on this column is what keeps two active appointments out of one slot.
     */
    @Column(name = "slot_key")
    private Instant slotKey;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String email;

    @Column(length = 50)
    @Builder.Default
    private String phone = "";

    @Column(length = 200)
    @Builder.Default
    private String reason = "";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Status status = Status.ACTIVE;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    /** Takes the slot at {@code start}; the flush decides whether it was free. */
    public void occupy(Instant start) {
        this.startTime = start;
        this.slotKey = start;
    }

    public void cancel() {
        this.status = Status.CANCELLED;
        this.slotKey = null;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
