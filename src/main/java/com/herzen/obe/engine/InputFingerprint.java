package com.herzen.obe.engine;

import com.herzen.obe.engine.EngineModels.CourseScopeInput;
import com.herzen.obe.engine.EngineModels.ProgramScopeInput;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

/**
 * SHA-256 checksum of the rows a computation consumed. Rows are rendered one per line and sorted,
 * so the checksum does not depend on load order.
 */
@Component
public class InputFingerprint {

    public String course(CourseScopeInput input) {
        List<String> lines = new ArrayList<>();
        lines.add("scope|" + input.scope().key());
        input.outcomes().forEach(o -> lines.add("co|" + o.coId() + "|" + o.expectedProficiency()));
        input.assessments().forEach(a -> lines.add("assessment|" + a.assessmentId() + "|" + a.category() + "|" + a.maxMarks()));
        input.components().forEach(c -> lines.add("component|" + c.assessmentId() + "|" + c.componentNumber() + "|" + c.coId() + "|" + c.maxMarks()));
        input.marks().forEach(m -> lines.add("mark|" + m.assessmentId() + "|" + m.componentNumber() + "|" + m.studentId() + "|" + m.mark()));
        input.enrolledStudents().forEach(s -> lines.add("student|" + s));
        input.surveys().forEach(s -> lines.add("survey|" + s.coId() + "|" + s.stronglyAgree() + "|" + s.agree() + "|"
                + s.neutral() + "|" + s.disagree() + "|" + s.totalRespondents()));
        input.mappings().forEach(m -> lines.add("mapping|" + m.coId() + "|" + m.poId() + "|" + m.level()));
        return digest(lines.stream());
    }

    public String program(ProgramScopeInput input) {
        List<String> lines = new ArrayList<>();
        lines.add("scope|" + input.scope().key());
        input.coursePos().forEach((courseId, rows) -> rows.forEach(r ->
                lines.add("course_po|" + courseId + "|" + r.poId() + "|" + r.value())));
        return digest(lines.stream());
    }

    private String digest(Stream<String> lines) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            lines.sorted().forEach(line -> {
                md.update(line.getBytes(StandardCharsets.UTF_8));
                md.update((byte) '\n');
            });
            return HexFormat.of().formatHex(md.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
