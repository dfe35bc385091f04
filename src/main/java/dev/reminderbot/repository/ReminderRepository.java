package dev.reminderbot.repository;

import dev.reminderbot.entity.ReminderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for reminder rows.
 */
@Repository
public interface ReminderRepository extends JpaRepository<ReminderEntity, Long> {

    List<ReminderEntity> findAllByOrderByIdAsc();

    /**
     * Find every reminder of one owner, paused or not.
     */
    List<ReminderEntity> findByOwnerOrderByIdAsc(long owner);

    /**
     * Find unpaused reminders whose next fire time is at or before the given instant.
     */
    List<ReminderEntity> findByPausedFalseAndNextFireLessThanEqualOrderByIdAsc(LocalDateTime now);

    List<ReminderEntity> findByPausedFalseOrderByIdAsc();
}
