package org.akton.arn;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.akton.arn.id.TypedId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * ARNs travel through JSON as their canonical string.
 */
class ArnJsonTest {

    record Grant(String name, Arn target) {}

    private static final String TEXT = "arn:prod:billing:acct1:usr_01h455vb4pex5vsknk084sn02q";

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
    }

    @Test
    void arn_serializesAsCanonicalString() throws Exception {
        Arn arn = Arn.parse(TEXT).getOrThrow();

        assertThat(objectMapper.writeValueAsString(arn)).isEqualTo("\"" + TEXT + "\"");
    }

    @Test
    void arn_deserializesInsideRecord() throws Exception {
        String json = """
            {"name": "read", "target": "%s"}
            """.formatted(TEXT);

        Grant grant = objectMapper.readValue(json, Grant.class);

        assertThat(grant.target()).isEqualTo(Arn.parse(TEXT).getOrThrow());
    }

    @Test
    void arn_malformedJsonValue_failsDeserialization() {
        assertThatThrownBy(() -> objectMapper.readValue("\"arn:pr#d:billing:acct1:usr_01h455vb4pex5vsknk084sn02q\"", Arn.class))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(ArnFailedException.class)
                .hasMessageContaining("position 1");
    }

    @Test
    void typedId_roundTripsAsString() throws Exception {
        TypedId id = TypedId.parse("usr_01h455vb4pex5vsknk084sn02q").getOrThrow();

        String json = objectMapper.writeValueAsString(id);

        assertThat(json).isEqualTo("\"usr_01h455vb4pex5vsknk084sn02q\"");
        assertThat(objectMapper.readValue(json, TypedId.class)).isEqualTo(id);
    }
}
