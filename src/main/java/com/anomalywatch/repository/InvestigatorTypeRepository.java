package com.anomalywatch.repository;

import com.anomalywatch.model.InvestigatorType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface InvestigatorTypeRepository extends JpaRepository<InvestigatorType, Long> {

    Optional<InvestigatorType> findByCode(String code);

    boolean existsByCode(String code);

    List<InvestigatorType> findAllByOrderByCodeAsc();
}
