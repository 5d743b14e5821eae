package com.herzen.obe.service;

import com.herzen.obe.domain.DomainModels.Semester;
import com.herzen.obe.repository.SemesterJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SemesterService {
    private final SemesterJdbcRepository repository;

    public SemesterService(SemesterJdbcRepository repository) {
        this.repository = repository;
    }

    public Semester lock(String semesterId) {
        repository.setLocked(semesterId, true);
        log.info("Semester {} locked", semesterId);
        return new Semester(semesterId, true);
    }

    public Semester unlock(String semesterId) {
        repository.setLocked(semesterId, false);
        log.info("Semester {} unlocked", semesterId);
        return new Semester(semesterId, false);
    }

    public Semester status(String semesterId) {
        return repository.find(semesterId).orElse(new Semester(semesterId, false));
    }
}
