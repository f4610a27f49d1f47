package com.example.AssessRec.controller;

import com.example.AssessRec.exception.DatasetFormatException;
import com.example.AssessRec.model.CatalogStatus;
import com.example.AssessRec.service.CatalogIndexService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CatalogController.class)
class CatalogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CatalogIndexService catalogIndexService;

    @Test
    @DisplayName("Build resets by default and reports the new status")
    void buildDefaultsToReset() throws Exception {
        when(catalogIndexService.build(true)).thenReturn(new CatalogStatus(true, 42, "memory"));

        mockMvc.perform(post("/api/catalog/build"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.built").value(true))
                .andExpect(jsonPath("$.count").value(42));
    }

    @Test
    @DisplayName("An unreadable catalog file maps to 400")
    void unreadableCatalog() throws Exception {
        when(catalogIndexService.build(false)).thenThrow(new DatasetFormatException("Catalog file not found: x"));

        mockMvc.perform(post("/api/catalog/build").param("reset", "false"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("dataset_format"));
    }

    @Test
    @DisplayName("Status reflects the index")
    void reportsStatus() throws Exception {
        when(catalogIndexService.status()).thenReturn(new CatalogStatus(false, 0, "memory"));

        mockMvc.perform(get("/api/catalog/status"))
                .andExpect(jsonPath("$.built").value(false))
                .andExpect(jsonPath("$.store").value("memory"));
    }
}
