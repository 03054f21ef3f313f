package com.repledger.audit;

import com.repledger.domain.model.ParameterChange;
import com.repledger.entity.ParameterChangeEntity;
import com.repledger.mapper.ParameterChangeMapper;
import com.repledger.repository.jpa.ParameterChangeJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records administrative parameter changes for audit.
 *
 * <p>The in-memory value is updated first, then the change is persisted, so the admin API
 * response reflects the new value immediately.
 */
@Service
public class ParameterHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ParameterHistoryService.class);

    private final ParameterChangeJpaRepository parameterChangeJpaRepository;
    private final ParameterChangeMapper parameterChangeMapper;

    public ParameterHistoryService(
            ParameterChangeJpaRepository parameterChangeJpaRepository, ParameterChangeMapper parameterChangeMapper) {
        this.parameterChangeJpaRepository = parameterChangeJpaRepository;
        this.parameterChangeMapper = parameterChangeMapper;
    }

    /**
     * Records a single change. Nothing is written when the value did not change.
     *
     * @param category  LEDGER, RISK, MODULE, PRICE or REPUTATION
     * @param name      parameter name (e.g. "originationFeeBps")
     * @param oldValue  previous value (null if newly set)
     * @param newValue  new value
     * @param changedBy admin account
     */
    public void recordChange(String category, String name, Object oldValue, Object newValue, String changedBy) {
        String oldText = oldValue != null ? String.valueOf(oldValue) : null;
        String newText = newValue != null ? String.valueOf(newValue) : null;
        if (Objects.equals(oldText, newText)) {
            return;
        }

        ParameterChangeEntity entity = ParameterChangeEntity.builder()
                .category(category)
                .name(name)
                .oldValue(oldText)
                .newValue(newText)
                .changedBy(changedBy)
                .timestamp(LocalDateTime.now())
                .build();

        parameterChangeJpaRepository.save(entity);
        log.info("Parameter change recorded: {}.{} = {} -> {} (by {})", category, name, oldText, newText, changedBy);
    }

    /** Full change history for one category, newest first. */
    public List<ParameterChange> getHistoryByCategory(String category) {
        return parameterChangeMapper.toDomainList(parameterChangeJpaRepository.findByCategoryOrderByTimestampDesc(category));
    }

    public List<ParameterChange> getAllHistory() {
        return parameterChangeMapper.toDomainList(parameterChangeJpaRepository.findAllByOrderByTimestampDesc());
    }
}
