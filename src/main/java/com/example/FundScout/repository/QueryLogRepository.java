package com.example.FundScout.repository;

import com.example.FundScout.model.QueryLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QueryLogRepository extends JpaRepository<QueryLog, Long> {

    List<QueryLog> findBySessionIdOrderByCreatedAtDesc(String sessionId);
}
