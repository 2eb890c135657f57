package com.mike.scrapescheduler.repository;

import com.mike.scrapescheduler.entity.Schedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface ScheduleRepository extends JpaRepository<Schedule, Long> {

    List<Schedule> findByActiveTrue();

    List<Schedule> findAllByOrderByCreatedAtDesc();

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Schedule s set s.nextRun = :nextRun where s.id = :id")
    int updateNextRun(@Param("id") Long id, @Param("nextRun") LocalDateTime nextRun);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Schedule s set s.active = :active where s.id = :id")
    int updateActive(@Param("id") Long id, @Param("active") boolean active);
}
