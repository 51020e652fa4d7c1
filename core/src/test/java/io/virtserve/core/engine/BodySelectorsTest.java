package io.virtserve.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.jayway.jsonpath.JsonPath;
import io.virtserve.core.model.Selector;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.xml.xpath.XPathExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BodySelectorsTest {

    private final RequestFields fields = RequestFields.of(JsonNodeFactory.instance.objectNode());

    private static Selector jsonPath(String expression) {
        return new Selector.JsonPathSelector(expression, JsonPath.compile(expression));
    }

    private static Selector xpath(String expression) {
        return new Selector.XPathSelector(expression, Map.of());
    }

    @Nested
    @DisplayName("jsonpath")
    class JsonPathSelection {

        private static final String BODY = """
                {"order": {"id": 17, "total": 12.50, "paid": true,
                 "lines": [{"sku": "A-1"}, {"sku": "B-2"}], "tags": ["x", "y"], "note": null}}
                """;

        @Test
        void scalarBecomesCanonicalText() {
            assertThat(BodySelectors.select(jsonPath("$.order.id"), BODY, fields).textValue()).isEqualTo("17");
            assertThat(BodySelectors.select(jsonPath("$.order.total"), BODY, fields).textValue()).isEqualTo("12.5");
            assertThat(BodySelectors.select(jsonPath("$.order.paid"), BODY, fields).textValue()).isEqualTo("true");
        }

        @Test
        void severalResultsBecomeArray() {
            JsonNode result = BodySelectors.select(jsonPath("$.order.lines[*].sku"), BODY, fields);

            assertThat(result.isArray()).isTrue();
            assertThat(result).extracting(JsonNode::textValue).containsExactly("A-1", "B-2");
        }

        @Test
        @DisplayName("A path selecting one array yields its elements")
        void singleArrayIsUnwrapped() {
            JsonNode result = BodySelectors.select(jsonPath("$.order.tags"), BODY, fields);

            assertThat(result).extracting(JsonNode::textValue).containsExactly("x", "y");
        }

        @Test
        void objectResultBecomesCompactJson() {
            JsonNode result = BodySelectors.select(jsonPath("$.order.lines[0]"), BODY, fields);

            assertThat(result.textValue()).isEqualTo("{\"sku\":\"A-1\"}");
        }

        @Test
        void missingPathFails() {
            assertThat(BodySelectors.select(jsonPath("$.order.customer"), BODY, fields)).isNull();
            assertThat(BodySelectors.select(jsonPath("$.order.lines[?(@.sku == 'Z')]"), BODY, fields)).isNull();
        }

        @Test
        void nonJsonValueFails() {
            assertThat(BodySelectors.select(jsonPath("$.a"), "<a>1</a>", fields)).isNull();
            assertThat(BodySelectors.select(jsonPath("$.a"), "", fields)).isNull();
        }
    }

    @Nested
    @DisplayName("xpath")
    class XPathSelection {

        private static final String BODY = "<books><book id=\"1\">Dune</book><book id=\"2\">Emma</book></books>";

        @Test
        void singleNodeBecomesItsText() {
            assertThat(BodySelectors.select(xpath("//book[@id='2']"), BODY, fields).textValue()).isEqualTo("Emma");
            assertThat(BodySelectors.select(xpath("//book[1]/@id"), BODY, fields).textValue()).isEqualTo("1");
        }

        @Test
        void severalNodesBecomeArray() {
            JsonNode result = BodySelectors.select(xpath("//book"), BODY, fields);

            assertThat(result).extracting(JsonNode::textValue).containsExactly("Dune", "Emma");
        }

        @Test
        void nonNodeResultUsesStringValue() {
            assertThat(BodySelectors.select(xpath("count(//book)"), BODY, fields).textValue()).isEqualTo("2");
        }

        @Test
        void namespacesAreBound() {
            String body = "<b:books xmlns:b=\"urn:books\"><b:title>Dune</b:title></b:books>";
            Selector selector = new Selector.XPathSelector("//lib:title", Map.of("lib", "urn:books"));

            assertThat(BodySelectors.select(selector, body, fields).textValue()).isEqualTo("Dune");
        }

        @Test
        void emptyNodeSetFails() {
            assertThat(BodySelectors.select(xpath("//magazine"), BODY, fields)).isNull();
        }

        @Test
        void nonXmlValueFails() {
            assertThat(BodySelectors.select(xpath("//a"), "{\"a\": 1}", fields)).isNull();
            assertThat(BodySelectors.select(xpath("//a"), "  ", fields)).isNull();
        }

        @Test
        void doctypeIsRefused() {
            String body = "<!DOCTYPE x [<!ENTITY e SYSTEM \"file:///etc/passwd\">]><x>&e;</x>";

            assertThat(BodySelectors.select(xpath("/x"), body, fields)).isNull();
        }

        @Test
        void malformedExpressionDoesNotCompile() {
            assertThatThrownBy(() -> BodySelectors.compileXPath("//[", Map.of()))
                    .isInstanceOf(XPathExpressionException.class);
        }
    }

    @Test
    @DisplayName("xpath selection from many threads at once returns each thread's own result")
    void concurrentXPathSelection() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> workers = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int id = t;
                workers.add(pool.submit(() -> {
                    RequestFields own = RequestFields.of(JsonNodeFactory.instance.objectNode());
                    int wrong = 0;
                    for (int i = 0; i < 200; i++) {
                        String body = "<order><id>" + id + "-" + i + "</id></order>";
                        JsonNode result = BodySelectors.select(xpath("//id"), body, own);
                        if (result == null || !(id + "-" + i).equals(result.textValue())) {
                            wrong++;
                        }
                    }
                    return wrong;
                }));
            }
            for (Future<Integer> worker : workers) {
                assertThat(worker.get(30, TimeUnit.SECONDS)).isZero();
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
