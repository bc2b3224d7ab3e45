package com.ecgheartbeat.backend.service;

import com.ecgheartbeat.backend.dto.SaveEcgRequest;
import com.ecgheartbeat.backend.entity.EcgResult;
import com.ecgheartbeat.backend.exception.NotFoundException;
import com.ecgheartbeat.backend.repository.EcgResultRepository;
import com.ecgheartbeat.backend.repository.UserRepository;
import com.ecgheartbeat.backend.service.classification.HeartRateAssessment;
import com.ecgheartbeat.backend.service.classification.HeartRateClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class EcgService {

    public static final String ECG_RECORD_NOT_FOUND = "ECG_RECORD_NOT_FOUND";

    private final EcgResultRepository ecgResultRepository;
    private final UserRepository userRepository;
    private final HeartRateClassifier heartRateClassifier;
    private final Clock clock;

    /**
     * Stores a reading stamped with the server's current date and time of day.
     */
    @Transactional
    public EcgResult save(SaveEcgRequest req) {
        requireUser(req.userId());

        HeartRateAssessment assessment = heartRateClassifier.classify(req.bpm());
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);

        EcgResult result = new EcgResult(
                req.userId(),
                req.username(),
                now.toLocalDate(),
                now.toLocalTime(),
                req.bpm(),
                assessment.status(),
                assessment.condition(),
                now
        );
        EcgResult saved = ecgResultRepository.save(result);
        log.info("Saved ECG result {} for user {}: {} BPM ({})",
                saved.getId(), saved.getUserId(), saved.getBpm(), saved.getStatus());
        return saved;
    }

    /**
     * Most recent reading first.
     */
    @Transactional(readOnly = true)
    public List<EcgResult> getHistory(Long userId) {
        return ecgResultRepository.findByUserIdOrderByTanggalDescWaktuDesc(userId);
    }

    @Transactional
    public HistoryPurge deleteHistory(Long userId) {
        requireUser(userId);

        long previousCount = ecgResultRepository.countByUserId(userId);
        int deletedCount = ecgResultRepository.deleteAllOwnedBy(userId);
        log.info("Deleted {} of {} ECG results for user {}", deletedCount, previousCount, userId);
        return new HistoryPurge(deletedCount, previousCount);
    }

    /**
     * Deletes one reading. A reading owned by someone else is reported as missing.
     */
    @Transactional
    public Long deleteRecord(Long userId, Long recordId) {
        EcgResult record = ecgResultRepository.findByIdAndUserId(recordId, userId)
                .orElseThrow(() -> new NotFoundException(ECG_RECORD_NOT_FOUND, "ECG record not found"));
        ecgResultRepository.delete(record);
        log.info("Deleted ECG result {} of user {}", recordId, userId);
        return record.getId();
    }

    private void requireUser(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new NotFoundException(ProfileService.USER_NOT_FOUND, "User not found");
        }
    }

    public record HistoryPurge(long deletedCount, long previousCount) {}
}
