package dev.pekelund.billing.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExemptionListTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void normalizesEntriesOnLoad() throws IOException {
        Path file = tempDir.resolve("exemption_list.json");
        Files.writeString(file, """
            {"exempted_work_requests": [" 12345678 ", "87654321.0", 90093002, 11111111.0, "", null]}
            """);

        ExemptionList list = ExemptionList.load(file, objectMapper);

        assertThat(list.workRequests()).containsExactly("12345678", "87654321", "90093002", "11111111");
        assertThat(list.contains("87654321")).isTrue();
        assertThat(list.contains("99999999")).isFalse();
    }

    @Test
    void missingFileYieldsEmptyList() {
        assertThat(ExemptionList.load(tempDir.resolve("absent.json"), objectMapper).isEmpty()).isTrue();
    }

    @Test
    void malformedFileYieldsEmptyList() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThat(ExemptionList.load(file, objectMapper).isEmpty()).isTrue();
    }

    @Test
    void fileWithoutExpectedKeyYieldsEmptyList() throws IOException {
        Path file = tempDir.resolve("other.json");
        Files.writeString(file, "{\"work_requests\": [\"1\"]}");

        assertThat(ExemptionList.load(file, objectMapper).isEmpty()).isTrue();
    }

    @Test
    void ofDropsBlankEntries() {
        ExemptionList list = ExemptionList.of(Arrays.asList("1", " ", null, "2.0"));

        assertThat(list.size()).isEqualTo(2);
        assertThat(list.workRequests()).containsExactly("1", "2");
    }
}
