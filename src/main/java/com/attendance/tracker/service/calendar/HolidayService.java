package com.attendance.tracker.service.calendar;

import com.attendance.tracker.common.DateFormats;
import com.attendance.tracker.common.constants.StreamTopics;
import com.attendance.tracker.common.exception.ConflictException;
import com.attendance.tracker.common.exception.EntityNotFoundException;
import com.attendance.tracker.common.exception.ValidationException;
import com.attendance.tracker.model.documents.Holiday;
import com.attendance.tracker.model.dto.PeriodReport;
import com.attendance.tracker.repo.documents.HolidayRepo;
import com.attendance.tracker.service.streaming.StreamGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class HolidayService {

    private final HolidayRepo holidayRepo;
    private final StreamGateway stream;
    private final Clock clock;

    /**
     * @param date null means today
     */
    public Holiday add(@Nullable LocalDate date, String description) {
        if (!StringUtils.hasText(description)) {
            throw new ValidationException("Holiday description must not be blank");
        }
        LocalDate day = date == null ? LocalDate.now(clock) : date;
        if (holidayRepo.existsByDate(day)) {
            throw new ConflictException(DateFormats.format(day) + " is already marked as a holiday");
        }
        Holiday holiday = Holiday.builder()
                .date(day)
                .description(description.trim())
                .createdAt(Instant.now(clock))
                .build();
        Holiday saved;
        try {
            saved = holidayRepo.save(holiday);
        } catch (DuplicateKeyException e) {
            // lost a race against another insert for the same date
            throw new ConflictException(DateFormats.format(day) + " is already marked as a holiday", e);
        }
        log.info("Marked {} as holiday: {}", DateFormats.format(day), saved.getDescription());
        stream.send(StreamTopics.HOLIDAY_ADDED, new PeriodReport.HolidayEntry(saved.getDate(), saved.getDescription()));
        return saved;
    }

    public void remove(LocalDate date) {
        long removed = holidayRepo.deleteByDate(date);
        if (removed == 0) {
            throw new EntityNotFoundException("No holiday found for " + DateFormats.format(date));
        }
        log.info("Removed holiday on {}", DateFormats.format(date));
        stream.send(StreamTopics.HOLIDAY_REMOVED, new PeriodReport.HolidayEntry(date, null));
    }

    public boolean isHoliday(LocalDate date) {
        return holidayRepo.existsByDate(date);
    }

    public Optional<Holiday> find(LocalDate date) {
        return holidayRepo.findByDate(date);
    }

    public List<Holiday> list() {
        return holidayRepo.findAllByOrderByDateAsc();
    }

    /**
     * Holidays in [from, to], ordered by date.
     */
    public List<Holiday> listBetween(LocalDate from, LocalDate to) {
        return holidayRepo.findInRange(from, to);
    }
}
