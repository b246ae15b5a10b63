package com.aporkolab.agentbus.transport;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TopicPatternTest {

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
            "failed.*,           failed.backend_1,          true",
            "failed.*,           failed.backend_1.tasks,    false",
            "failed.#,           failed.backend_1.tasks,    true",
            "failed.#,           failed,                    true",
            "dlx.*,              failed.backend_1,          false",
            "agent.qa_1.*,       agent.qa_1.task,           true",
            "agent.qa_1.*,       agent.qa_2.task,           false",
            "error.*.*,          error.qa_1.timeout,        true",
            "broadcast.*,        broadcast.shutdown,        true",
            "system.planning,    system.planning,           true",
            "#,                  anything.at.all,           true",
            "*.status,           agent.status,              true"
    })
    void shouldMatchTopicSemantics(String pattern, String routingKey, boolean expected) {
        assertThat(TopicPattern.matches(pattern, routingKey)).isEqualTo(expected);
    }
}
