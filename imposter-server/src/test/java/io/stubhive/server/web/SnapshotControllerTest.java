package io.stubhive.server.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.stubhive.imposter.registry.ImposterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class SnapshotControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ImposterRegistry registry;

    @TempDir
    static Path tempDir;

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("stubhive.host", () -> "127.0.0.1");
        registry.add("stubhive.snapshot.file", () -> tempDir.resolve("snapshots").resolve("mb.json").toString());
    }

    @AfterEach
    void cleanUp() {
        registry.deleteAll();
    }

    @Test
    void restoreThenSaveGivesBackTheDocument() throws Exception {
        mvc.perform(put("/snapshot").contentType(MediaType.APPLICATION_JSON).content("""
                {"imposters": [
                  {"protocol": "http", "name": "one", "stubs": [{"responses": [{"is": {"body": "1"}}]}]},
                  {"protocol": "tcp", "name": "two"}
                ]}
                """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imposters", hasSize(2)));

        mvc.perform(get("/snapshot"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imposters", hasSize(2)))
            .andExpect(jsonPath("$.imposters[?(@.name == 'one')].stubs[0].responses[0].is.body").value("1"))
            .andExpect(jsonPath("$.imposters[0].numberOfRequests").doesNotExist());
    }

    @Test
    void malformedSnapshotIsBadData() throws Exception {
        mvc.perform(put("/snapshot").contentType(MediaType.APPLICATION_JSON).content("{\"imposters\": 5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors[0].code").value("bad data"));
    }

    @Test
    void replayReturnsTheFrozenState() throws Exception {
        mvc.perform(put("/snapshot").contentType(MediaType.APPLICATION_JSON)
                .content("{\"imposters\": [{\"protocol\": \"smtp\"}]}"))
            .andExpect(status().isOk());

        mvc.perform(post("/snapshot/replay"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.imposters[0].protocol").value("smtp"));

        assertThat(registry.list()).hasSize(1);
    }

    @Test
    void snapshotIsWrittenToTheConfiguredFile() throws Exception {
        mvc.perform(put("/snapshot").contentType(MediaType.APPLICATION_JSON)
                .content("{\"imposters\": [{\"protocol\": \"http\", \"name\": \"saved\"}]}"))
            .andExpect(status().isOk());

        mvc.perform(post("/snapshot/file"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.file").value(tempDir.resolve("snapshots").resolve("mb.json").toAbsolutePath().toString()))
            .andExpect(jsonPath("$.imposters[0].name").value("saved"));

        assertThat(Files.readString(tempDir.resolve("snapshots").resolve("mb.json"))).contains("\"saved\"");
    }
}
