package com.herzen.obe.service;

import com.herzen.obe.audit.AuditEmitter;
import com.herzen.obe.audit.AuditModels.AuditEvent;
import com.herzen.obe.audit.AuditModels.RunStatus;
import com.herzen.obe.cqi.CqiActionSink;
import com.herzen.obe.domain.DomainModels.Course;
import com.herzen.obe.engine.AttainmentEngine;
import com.herzen.obe.engine.AttainmentWarnings;
import com.herzen.obe.engine.EngineModels.*;
import com.herzen.obe.engine.InputFingerprint;
import com.herzen.obe.exception.AttainmentException;
import com.herzen.obe.exception.ErrorCode;
import com.herzen.obe.exception.ScopeNotFoundException;
import com.herzen.obe.governance.GovernanceModels.GovernanceSnapshot;
import com.herzen.obe.governance.GovernanceService;
import com.herzen.obe.repository.AttainmentResultJdbcRepository;
import com.herzen.obe.repository.AttainmentResultJdbcRepository.RunRow;
import com.herzen.obe.repository.CourseSetupJdbcRepository;
import com.herzen.obe.repository.SemesterJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class AttainmentService {
    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final CourseSetupJdbcRepository setupRepository;
    private final SemesterJdbcRepository semesterRepository;
    private final AttainmentResultJdbcRepository resultRepository;
    private final GovernanceService governanceService;
    private final AttainmentEngine engine;
    private final InputFingerprint fingerprint;
    private final ScopeLockRegistry scopeLocks;
    private final AuditEmitter auditEmitter;
    private final CqiActionSink cqiActionSink;
    private final Executor executor;

    public AttainmentService(CourseSetupJdbcRepository setupRepository,
                             SemesterJdbcRepository semesterRepository,
                             AttainmentResultJdbcRepository resultRepository,
                             GovernanceService governanceService,
                             AttainmentEngine engine,
                             InputFingerprint fingerprint,
                             ScopeLockRegistry scopeLocks,
                             AuditEmitter auditEmitter,
                             CqiActionSink cqiActionSink,
                             @Qualifier("attainmentExecutor") Executor executor) {
        this.setupRepository = setupRepository;
        this.semesterRepository = semesterRepository;
        this.resultRepository = resultRepository;
        this.governanceService = governanceService;
        this.engine = engine;
        this.fingerprint = fingerprint;
        this.scopeLocks = scopeLocks;
        this.auditEmitter = auditEmitter;
        this.cqiActionSink = cqiActionSink;
        this.executor = executor;
    }

    public CourseRun computeCourse(String courseId) {
        Course course = setupRepository.findCourse(courseId)
                .orElseThrow(() -> new ScopeNotFoundException("course", courseId));
        String scopeKey = new CourseScope(course.courseId(), course.semesterId(), false).key();
        if (scopeLocks.isRunning(scopeKey)) {
            log.info("{} is being computed, {} run(s) already waiting", scopeKey, scopeLocks.queueLength(scopeKey));
        }
        return scopeLocks.runExclusive(scopeKey, () -> runCourse(course));
    }

    /**
     * Computes several course scopes concurrently. A failing scope does not stop the others; its
     * error code is reported in the outcome instead.
     */
    public List<BatchOutcome> computeCourses(List<String> courseIds) {
        List<CompletableFuture<BatchOutcome>> futures = courseIds.stream()
                .distinct()
                .map(courseId -> CompletableFuture
                        .supplyAsync(() -> computeCourse(courseId), executor)
                        .handle((run, error) -> run != null
                                ? new BatchOutcome(courseId, run, null, null)
                                : failedOutcome(courseId, error)))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    public ProgramRun computeProgram(String programId, String semesterId) {
        String scopeKey = new ProgramScope(programId, semesterId, false).key();
        if (scopeLocks.isRunning(scopeKey)) {
            log.info("{} is being computed, {} run(s) already waiting", scopeKey, scopeLocks.queueLength(scopeKey));
        }
        return scopeLocks.runExclusive(scopeKey, () -> runProgram(programId, semesterId));
    }

    public Optional<CourseAttainmentView> latestCourse(String courseId) {
        Course course = setupRepository.findCourse(courseId)
                .orElseThrow(() -> new ScopeNotFoundException("course", courseId));
        String scopeKey = new CourseScope(course.courseId(), course.semesterId(), false).key();
        return resultRepository.latestRun(scopeKey).map(run -> new CourseAttainmentView(run,
                resultRepository.loadAssessmentAttainments(run.runId()),
                resultRepository.loadFinals(run.runId()),
                resultRepository.loadCoursePos(run.runId())));
    }

    public Optional<ProgramAttainmentView> latestProgram(String programId, String semesterId) {
        String scopeKey = new ProgramScope(programId, semesterId, false).key();
        return resultRepository.latestRun(scopeKey)
                .map(run -> new ProgramAttainmentView(run, resultRepository.loadProgramPos(run.runId())));
    }

    /**
     * Runs under the scope lock. The semester lock is read here so a run queued behind another one
     * sees a lock taken while it was waiting.
     */
    private CourseRun runCourse(Course course) {
        CourseScope scope = new CourseScope(course.courseId(), course.semesterId(),
                semesterRepository.isLocked(course.semesterId()));
        String runId = UUID.randomUUID().toString();
        GovernanceSnapshot governance = null;
        String checksum = null;
        try {
            governance = governanceService.capture();
            log.info("Computing {} run={} governance={}", scope.key(), runId, governance.version());

            CourseScopeInput input = loadCourseInput(scope);
            checksum = fingerprint.course(input);
            CourseAttainmentResult result = engine.computeCourse(input, governance);

            Instant now = Instant.now();
            long version = resultRepository.saveCourseResult(runId, checksum, now, result);
            cqiActionSink.submit(runId, result.cqiRequests());
            result.warnings().forEach(w -> log.warn("{} {} {}: {}", scope.key(), w.code(), w.entityId(), w.message()));
            auditEmitter.emit(new AuditEvent(runId, "course", scope.key(), RunStatus.SUCCEEDED, governance.version(),
                    checksum, result.warnings(), null, null, now));
            log.info("Stored {} version {} ({} outcomes, {} POs)", scope.key(), version, result.finals().size(), result.coursePos().size());
            return new CourseRun(runId, version, checksum, result);
        } catch (RuntimeException e) {
            auditFailure(runId, "course", scope.key(), governance, checksum, e);
            throw e;
        }
    }

    private ProgramRun runProgram(String programId, String semesterId) {
        ProgramScope scope = new ProgramScope(programId, semesterId, semesterRepository.isLocked(semesterId));
        String runId = UUID.randomUUID().toString();
        GovernanceSnapshot governance = null;
        String checksum = null;
        try {
            governance = governanceService.capture();
            log.info("Computing {} run={} governance={}", scope.key(), runId, governance.version());

            List<AttainmentWarning> loadWarnings = new ArrayList<>();
            Map<String, List<CoursePoAttainment>> coursePos = new TreeMap<>();
            for (Course course : setupRepository.findCoursesInProgram(programId, semesterId)) {
                String courseKey = new CourseScope(course.courseId(), course.semesterId(), false).key();
                Optional<RunRow> latest = resultRepository.latestRun(courseKey);
                if (latest.isEmpty()) {
                    loadWarnings.add(new AttainmentWarning(AttainmentWarnings.COURSE_NOT_COMPUTED, scope.key(), course.courseId(),
                            "Course has no computed attainment and does not contribute"));
                    continue;
                }
                coursePos.put(course.courseId(), resultRepository.loadCoursePos(latest.get().runId()));
            }

            ProgramScopeInput input = new ProgramScopeInput(scope, coursePos);
            checksum = fingerprint.program(input);
            ProgramAttainmentResult computed = engine.computeProgram(input, governance);

            List<AttainmentWarning> warnings = new ArrayList<>(computed.warnings());
            warnings.addAll(loadWarnings);
            ProgramAttainmentResult result = new ProgramAttainmentResult(computed.scope(), computed.governanceVersion(),
                    computed.programPos(), List.copyOf(warnings));

            Instant now = Instant.now();
            long version = resultRepository.saveProgramResult(runId, checksum, now, result);
            result.warnings().forEach(w -> log.warn("{} {} {}: {}", scope.key(), w.code(), w.entityId(), w.message()));
            auditEmitter.emit(new AuditEvent(runId, "program", scope.key(), RunStatus.SUCCEEDED, governance.version(),
                    checksum, result.warnings(), null, null, now));
            log.info("Stored {} version {} ({} POs)", scope.key(), version, result.programPos().size());
            return new ProgramRun(runId, version, checksum, result);
        } catch (RuntimeException e) {
            auditFailure(runId, "program", scope.key(), governance, checksum, e);
            throw e;
        }
    }

    private CourseScopeInput loadCourseInput(CourseScope scope) {
        String courseId = scope.courseId();
        return new CourseScopeInput(scope,
                setupRepository.loadOutcomes(courseId),
                setupRepository.loadAssessments(courseId),
                setupRepository.loadComponents(courseId),
                setupRepository.loadMarks(courseId),
                setupRepository.loadEnrollment(courseId),
                setupRepository.loadSurveys(courseId),
                setupRepository.loadMappings(courseId));
    }

    /**
     * Records the refused or failed run. A failure to write the audit row is attached to the
     * original exception, which the caller rethrows.
     */
    private void auditFailure(String runId, String scopeType, String scopeKey, GovernanceSnapshot governance,
                              String checksum, RuntimeException e) {
        RunStatus status = RunStatus.REJECTED;
        String errorCode = INTERNAL_ERROR;
        if (e instanceof AttainmentException ae) {
            errorCode = ae.getErrorCode().name();
            if (ae.getErrorCode() == ErrorCode.LOCKED_SCOPE) status = RunStatus.LOCKED;
            log.warn("{} refused ({}): {}", scopeKey, errorCode, e.getMessage());
        } else {
            log.error("{} failed", scopeKey, e);
        }
        try {
            auditEmitter.emit(new AuditEvent(runId, scopeType, scopeKey, status, governance == null ? 0 : governance.version(),
                    checksum, List.of(), errorCode, e.getMessage(), Instant.now()));
        } catch (RuntimeException auditError) {
            log.error("Audit of run {} for {} could not be written", runId, scopeKey, auditError);
            e.addSuppressed(auditError);
        }
    }

    private BatchOutcome failedOutcome(String courseId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof AttainmentException ae) {
            return new BatchOutcome(courseId, null, ae.getErrorCode().name(), ae.getMessage());
        }
        log.error("Computation of course {} failed", courseId, cause);
        return new BatchOutcome(courseId, null, INTERNAL_ERROR, cause.getMessage());
    }

    public record CourseRun(String runId, long version, String inputChecksum, CourseAttainmentResult result) {}

    public record ProgramRun(String runId, long version, String inputChecksum, ProgramAttainmentResult result) {}

    public record BatchOutcome(String courseId, CourseRun run, String errorCode, String message) {}

    public record CourseAttainmentView(RunRow run,
                                       List<CoAssessmentAttainment> assessmentAttainments,
                                       List<CoFinalAttainment> finals,
                                       List<CoursePoAttainment> coursePos) {}

    public record ProgramAttainmentView(RunRow run, List<ProgramPoAttainment> programPos) {}
}
