package com.costtracker.costs.requestlog;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RequestLogRepository extends JpaRepository<RequestLogEntity, Long> {
    List<RequestLogEntity> findAllByOrderByTsDescIdDesc();
}
