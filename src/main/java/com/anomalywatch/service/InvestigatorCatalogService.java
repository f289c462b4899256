package com.anomalywatch.service;

import com.anomalywatch.config.RedisConfig;
import com.anomalywatch.model.InvestigatorType;
import com.anomalywatch.repository.InvestigatorTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the investigator type catalog.
 *
 * Lookups by code are cached in the investigatorTypes region; the catalog is
 * consulted on every create and start.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvestigatorCatalogService {

    private final InvestigatorTypeRepository typeRepository;

    @Cacheable(value = RedisConfig.INVESTIGATOR_TYPES_CACHE, key = "#code", unless = "#result == null")
    @Transactional(readOnly = true)
    public Optional<InvestigatorType> findByCode(String code) {
        log.debug("Loading investigator type {} from database", code);
        return typeRepository.findByCode(code);
    }

    @Transactional(readOnly = true)
    public List<InvestigatorType> listTypes() {
        return typeRepository.findAllByOrderByCodeAsc();
    }

    /**
     * Insert or update a catalog entry.
     */
    @CacheEvict(value = RedisConfig.INVESTIGATOR_TYPES_CACHE, key = "#type.code")
    @Transactional
    public InvestigatorType save(InvestigatorType type) {
        InvestigatorType saved = typeRepository.save(type);
        log.info("Saved investigator type {}", saved.getCode());
        return saved;
    }
}
