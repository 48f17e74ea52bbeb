package com.example.brd;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.brd.model.Taxonomy;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class BrdClassifierApplicationTests {

    @Autowired private Taxonomy taxonomy;
    @Autowired private MockMvc mockMvc;

    @Test
    void loadsBundledTaxonomy() {
        assertThat(taxonomy.sectionIds()).startsWith("BRD-01").endsWith("BRD-99");
        assertThat(taxonomy.fallbackSectionId()).isEqualTo("BRD-99");
    }

    @Test
    void classifiesAgainstBundledTaxonomy() throws Exception {
        String json = """
                { "sourceDocument": { "relativePath": "confluence/SEC/login.md" },
                  "requirements": [
                    { "id": "SEC-1", "kind": "Functional", "statement": "Users must reset passwords" },
                    { "id": "BIZ-1", "kind": "Business", "statement": "Grow revenue" },
                    { "id": "MISC-1", "kind": "Glossary" } ] }
                """;
        MockMultipartFile file = new MockMultipartFile("files", "login.requirements.json",
                MediaType.APPLICATION_JSON_VALUE, json.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/classify").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Canonical Requirements"))
                .andExpect(jsonPath("$.totalRequirements").value(3))
                .andExpect(jsonPath("$.sections[0].requirements[0].id").value("BIZ-1"))
                .andExpect(jsonPath("$.sections[2].requirements[0].id").value("SEC-1"))
                .andExpect(jsonPath("$.sections[7].id").value("BRD-99"))
                .andExpect(jsonPath("$.sections[7].requirements[0].id").value("MISC-1"));
    }
}
