package dev.reminderbot.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persistent row for a reminder. Only {@link dev.reminderbot.store.JpaReminderStore} touches it;
 * the rest of the application works with {@link dev.reminderbot.model.Reminder} values.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "reminders", indexes = {
        @Index(name = "idx_owner", columnList = "owner"),
        @Index(name = "idx_next_fire", columnList = "nextFire")
})
public class ReminderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime nextFire;

    @Column(nullable = false)
    private String schedule;

    @Column(nullable = false, length = 4096)
    private String payload;

    @Column(nullable = false)
    private long owner;

    @Column(nullable = false)
    private boolean paused;

    @Version
    private Long version;
}
