package com.example.servicedesk.repository;

import com.example.servicedesk.domain.BatchConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BatchConfigurationRepository extends JpaRepository<BatchConfiguration, String> {

    List<BatchConfiguration> findByActiveTrueOrderByBatchKeyAsc();
}
