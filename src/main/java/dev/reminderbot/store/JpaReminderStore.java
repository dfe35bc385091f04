package dev.reminderbot.store;

import dev.reminderbot.entity.ReminderEntity;
import dev.reminderbot.exception.InvalidScheduleException;
import dev.reminderbot.model.Reminder;
import dev.reminderbot.repository.ReminderRepository;
import dev.reminderbot.schedule.ScheduleParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ReminderStore} backed by Spring Data JPA.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaReminderStore implements ReminderStore {

    private final ReminderRepository reminderRepository;
    private final ScheduleParser scheduleParser;

    @Override
    @Transactional(readOnly = true)
    public Optional<Reminder> get(long id) {
        return reminderRepository.findById(id).map(this::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reminder> getAll() {
        return toModels(reminderRepository.findAllByOrderByIdAsc());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reminder> getAllFor(long owner) {
        return toModels(reminderRepository.findByOwnerOrderByIdAsc(owner));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reminder> getDue(LocalDateTime now) {
        return toModels(reminderRepository.findByPausedFalseAndNextFireLessThanEqualOrderByIdAsc(now));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Reminder> getActive() {
        return toModels(reminderRepository.findByPausedFalseOrderByIdAsc());
    }

    @Override
    @Transactional
    public Reminder put(Reminder reminder) {
        ReminderEntity saved = reminderRepository.saveAndFlush(toEntity(reminder));
        return reminder.toBuilder()
                .id(saved.getId())
                .version(saved.getVersion())
                .build();
    }

    @Override
    @Transactional
    public void delete(long id) {
        reminderRepository.deleteById(id);
    }

    /**
     * Rows whose stored schedule no longer parses are reported and left out of bulk reads.
     */
    private List<Reminder> toModels(List<ReminderEntity> entities) {
        return entities.stream()
                .map(entity -> {
                    try {
                        return toModel(entity);
                    } catch (InvalidScheduleException e) {
                        log.error("Reminder {} has an unreadable schedule '{}' and is skipped: {}",
                                entity.getId(), entity.getSchedule(), e.getMessage());
                        return null;
                    }
                })
                .filter(Objects::nonNull)
                .toList();
    }

    private Reminder toModel(ReminderEntity entity) {
        return Reminder.builder()
                .id(entity.getId())
                .createdAt(entity.getCreatedAt())
                .nextFire(entity.getNextFire())
                .schedule(scheduleParser.parse(entity.getSchedule()))
                .payload(entity.getPayload())
                .owner(entity.getOwner())
                .paused(entity.isPaused())
                .version(entity.getVersion())
                .build();
    }

    private ReminderEntity toEntity(Reminder reminder) {
        return ReminderEntity.builder()
                .id(reminder.getId())
                .createdAt(reminder.getCreatedAt())
                .nextFire(reminder.getNextFire())
                .schedule(reminder.getSchedule().expression())
                .payload(reminder.getPayload())
                .owner(reminder.getOwner())
                .paused(reminder.isPaused())
                .version(reminder.getVersion())
                .build();
    }
}
