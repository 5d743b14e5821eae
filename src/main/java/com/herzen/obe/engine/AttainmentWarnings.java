package com.herzen.obe.engine;

public final class AttainmentWarnings {
    public static final String EMPTY_DENOMINATOR = "empty_denominator";
    public static final String MISSING_INDIRECT_DATA = "missing_indirect_data";
    public static final String CONFIG_INCONSISTENCY = "config_inconsistency";
    public static final String SURVEY_COUNT_MISMATCH = "survey_count_mismatch";
    public static final String NO_ASSESSMENTS = "no_assessments";
    public static final String NO_STUDENTS = "no_students";
    public static final String COURSE_NOT_COMPUTED = "course_not_computed";

    private AttainmentWarnings() {}
}
