package com.example.servicedesk.repository;

import com.example.servicedesk.domain.EscalationRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EscalationRuleRepository extends JpaRepository<EscalationRule, String> {

    List<EscalationRule> findByActiveTrueOrderByPriorityAscIdAsc();
}
