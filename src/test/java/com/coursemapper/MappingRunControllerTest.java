package com.coursemapper;

import com.coursemapper.domain.DomainModels.CatalogCourse;
import com.coursemapper.domain.DomainModels.RequirementBlock;
import com.coursemapper.repository.ActivePlanJdbcRepository;
import com.coursemapper.repository.CatalogJdbcRepository;
import com.coursemapper.repository.RequirementBlockJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static com.coursemapper.support.MapperFixture.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MappingRunControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RequirementBlockJdbcRepository blockRepository;

    @Autowired
    private CatalogJdbcRepository catalogRepository;

    @Autowired
    private ActivePlanJdbcRepository planRepository;

    @BeforeEach
    void seed() {
        catalogRepository.save("ENG01", new CatalogCourse(4001, 1, "Composition", "3", "UGRD", "ENG", "110"), true);
        blockRepository.save(new RequirementBlock("ENG01", "RA400001", "MAJOR", "ENG-BA", "English BA",
                "2020-09-01", "99999999", null,
                tree("[" + classCredit("Writing", "[\"ENG\", \"110\", null]", "") + "]")));
        planRepository.savePlan("ENG01", plan("ENG-BA", "MAJ"), "RA400001");

        blockRepository.save(new RequirementBlock("ERR01", "RA500001", "MAJOR", "ERR-BA", "Broken BA",
                "2020-09-01", "99999999", null, tree("[{\"frobnicate\": {}}]")));
        planRepository.savePlan("ERR01", plan("ERR-BA", "MAJ"), "RA500001");
    }

    @Test
    void runsAndServesCourseMappings() throws Exception {
        mockMvc.perform(post("/api/mapper/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"institutions\": [\"ENG01\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plans").value(1))
                .andExpect(jsonPath("$.requirements").value(1))
                .andExpect(jsonPath("$.courseMappings").value(1));

        mockMvc.perform(get("/api/mapper/requirements/1/courses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].courseId").value("004001:1"))
                .andExpect(jsonPath("$[0].course").value("ENG 110: Composition"));
    }

    @Test
    void structuralErrorIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/mapper/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"institutions\": [\"ERR01\"]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("STRUCTURE_001"))
                .andExpect(jsonPath("$.requirementId").value("RA500001"))
                .andExpect(jsonPath("$.node").value("frobnicate"));
    }
}
