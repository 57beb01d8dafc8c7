package io.otto4j.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.otto4j.core.RunStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TaskResultParserTest {

    private final TaskResultParser parser = new TaskResultParser(new ObjectMapper());

    @Test
    void parsesPlainJsonResult() {
        ResultParseOutcome outcome = parser.parse("{\"status\":\"success\",\"summary\":\" Sent digest \",\"errors\":[]}");

        assertThat(outcome).isInstanceOf(ResultParseOutcome.Parsed.class);
        assertThat(outcome.result().status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(outcome.result().summary()).isEqualTo("Sent digest");
        assertThat(outcome.rawOutput()).isNull();
    }

    @Test
    void parsesFencedJsonSurroundedByProse() {
        String output = "Here is the result:\n```json\n{\"status\":\"skipped\",\"summary\":\"Nothing new\"}\n```\nDone.";

        ResultParseOutcome outcome = parser.parse(output);

        assertThat(outcome).isInstanceOf(ResultParseOutcome.FencedParsed.class);
        assertThat(outcome.result().status()).isEqualTo(RunStatus.SKIPPED);
    }

    @Test
    void nonJsonOutputBecomesInvalidResultJsonFailure() {
        ResultParseOutcome outcome = parser.parse("  I could not finish the task.  ");

        assertThat(outcome).isInstanceOf(ResultParseOutcome.ParseFailed.class);
        ResultParseOutcome.ParseFailed failed = (ResultParseOutcome.ParseFailed) outcome;
        assertThat(failed.code()).isEqualTo(TaskResultParser.INVALID_RESULT_JSON);
        assertThat(failed.rawOutput()).isEqualTo("I could not finish the task.");
        assertThat(outcome.result().status()).isEqualTo(RunStatus.FAILED);
        assertThat(outcome.result().runErrorCode()).isEqualTo(TaskResultParser.INVALID_RESULT_JSON);
    }

    @Test
    void emptyOutputHasNoRawOutput() {
        ResultParseOutcome.ParseFailed failed = (ResultParseOutcome.ParseFailed) parser.parse("   ");

        assertThat(failed.reason()).isEqualTo("Task execution returned empty output");
        assertThat(failed.rawOutput()).isNull();
    }

    @Test
    void statusMustBeExactLowercaseValue() {
        ResultParseOutcome outcome = parser.parse("{\"status\":\"SUCCESS\",\"summary\":\"ok\"}");

        assertThat(outcome).isInstanceOf(ResultParseOutcome.ParseFailed.class);
        assertThat(((ResultParseOutcome.ParseFailed) outcome).code()).isEqualTo(TaskResultParser.INVALID_RESULT_SCHEMA);
    }

    @Test
    void blankSummaryIsRejected() {
        ResultParseOutcome outcome = parser.parse("{\"status\":\"success\",\"summary\":\"   \"}");

        assertThat(((ResultParseOutcome.ParseFailed) outcome).reason()).contains("summary");
    }

    @Test
    void stringErrorsAreNormalized() {
        ResultParseOutcome outcome = parser.parse(
                "{\"status\":\"failed\",\"summary\":\"Mail sync broke\",\"errors\":[\"imap timeout\",{\"code\":\"auth\",\"message\":\"expired token\"}]}");

        TaskResult result = outcome.result();
        assertThat(result.errors()).containsExactly(
                new TaskError("task_error", "imap timeout"),
                new TaskError("auth", "expired token"));
        assertThat(result.runErrorCode()).isEqualTo("task_error");
        assertThat(result.runErrorMessage()).isEqualTo("imap timeout");
    }

    @Test
    void nonArrayErrorsAreIgnored() {
        ResultParseOutcome text = parser.parse("{\"status\":\"success\",\"summary\":\"done\",\"errors\":\"none\"}");
        ResultParseOutcome object = parser.parse("{\"status\":\"success\",\"summary\":\"done\",\"errors\":{}}");

        assertThat(text).isInstanceOf(ResultParseOutcome.Parsed.class);
        assertThat(text.result().status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(text.result().errors()).isEmpty();
        assertThat(object).isInstanceOf(ResultParseOutcome.Parsed.class);
        assertThat(object.result().status()).isEqualTo(RunStatus.SUCCESS);
    }

    @Test
    void failedWithoutErrorsFallsBackToSummary() {
        TaskResult result = parser.parse("{\"status\":\"failed\",\"summary\":\"Could not reach calendar\"}").result();

        assertThat(result.runErrorCode()).isEqualTo("task_failed");
        assertThat(result.runErrorMessage()).isEqualTo("Could not reach calendar");
    }

    @Test
    void trailingGarbageIsNotAcceptedAsDirectJson() {
        ResultParseOutcome outcome = parser.parse("{\"status\":\"success\",\"summary\":\"ok\"} trailing");

        assertThat(outcome).isInstanceOf(ResultParseOutcome.ParseFailed.class);
    }
}
