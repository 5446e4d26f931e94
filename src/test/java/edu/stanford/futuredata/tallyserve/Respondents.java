package edu.stanford.futuredata.tallyserve;

import edu.stanford.futuredata.tallyserve.expression.Record;
import edu.stanford.futuredata.tallyserve.expression.Value;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Survey respondents shared by the shard, evaluator and integration tests.
 */
public final class Respondents {

    public static final String GENDER = "Gender";
    public static final String AGE = "Age";

    private Respondents() {}

    public static long day(String isoDate) {
        return LocalDate.parse(isoDate).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    public static Value date(String isoDate) {
        return Value.ofDate(day(isoDate));
    }

    private static Record respondent(String id, String gender, String genderWhen, String age) {
        return Record.builder(id)
                .field(GENDER, Value.ofString(gender), day(genderWhen))
                .field(AGE, Value.ofString(age), day("2021-03-01"))
                .build();
    }

    public static List<Record> records() {
        return List.of(
                respondent("Alice", "Female", "2020-04-01", "Middle Age"),
                respondent("Bob", "Male", "2009-06-01", "Middle Age"),
                respondent("Carol", "Female", "2020-06-15", "Young"),
                respondent("Dan", "Male", "2015-02-01", "Old"),
                respondent("Eve", "Male", "2012-08-01", "Middle Age"));
    }

    public static Record frank() {
        return Record.builder("Frank").field(GENDER, Value.ofString("Male"), day("2021-05-01")).build();
    }
}
