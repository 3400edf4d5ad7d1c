package com.example.servicedesk.repository;

import com.example.servicedesk.domain.FilterRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FilterRuleRepository extends JpaRepository<FilterRule, String> {

    List<FilterRule> findByActiveTrueOrderByPriorityAscIdAsc();

    List<FilterRule> findByOwnerUserId(String ownerUserId);
}
