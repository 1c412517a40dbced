package com.tazrim.ledger.controller;

import static com.tazrim.ledger.support.LedgerTables.csv;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazrim.ledger.support.LedgerTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class ImportsControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    ApplicationContext context;

    @BeforeEach
    void setUp() {
        LedgerTables.clear(context);
    }

    @Test
    void importsCardStatement() throws Exception {
        MockMultipartFile file = statement("jan.csv",
                "Transaction Date,Merchant,Amount,Category",
                "03/01/2024,Super-Pharm,-45.90,Groceries",
                ",,,");

        mockMvc.perform(multipart("/imports").file(file)
                        .param("account", "Visa 1234")
                        .param("period", "2024-01")
                        .header("X-Request-Trace", "trace-123"))
                .andExpect(status().isCreated())
                .andExpect(header().string("X-Request-Trace", "trace-123"))
                .andExpect(jsonPath("$.totalRows").value(2))
                .andExpect(jsonPath("$.insertedRows").value(1))
                .andExpect(jsonPath("$.newEntities").value(1))
                .andExpect(jsonPath("$.unmappedEntities").value(0))
                .andExpect(jsonPath("$.skipped[0].rowIndex").value(3))
                .andExpect(jsonPath("$.skipped[0].reason").value("empty row"))
                .andExpect(jsonPath("$.traceId").value("trace-123"));

        mockMvc.perform(get("/imports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batches[0].accountName").value("Visa 1234"))
                .andExpect(jsonPath("$.batches[0].activityCount").value(1));

        mockMvc.perform(get("/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories[0].name").value("Groceries"));
    }

    @Test
    void missingColumnsAreReported() throws Exception {
        MockMultipartFile file = statement("bad.csv", "Foo,Bar", "1,2");

        mockMvc.perform(multipart("/imports").file(file)
                        .param("account", "Visa 1234")
                        .param("period", "2024-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_COLUMNS"))
                .andExpect(jsonPath("$.details.missing").isArray());
    }

    @Test
    void unparseableAmountIsUnprocessable() throws Exception {
        MockMultipartFile file = statement("amount.csv",
                "Transaction Date,Merchant,Amount",
                "03/01/2024,Shop,abc");

        mockMvc.perform(multipart("/imports").file(file)
                        .param("account", "Visa 1234")
                        .param("period", "2024-01"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_AMOUNT"))
                .andExpect(jsonPath("$.details.row").value(2));
    }

    @Test
    void overlongReferenceIsUnprocessable() throws Exception {
        MockMultipartFile file = statement("bank.csv",
                "Date,Description,Reference,Debit,Credit",
                "01/01/2024,Rent,100,5000.00,",
                "02/01/2024,Fee," + "R".repeat(101) + ",10.00,");

        mockMvc.perform(multipart("/imports").file(file)
                        .param("account", "Checking")
                        .param("period", "2024-01"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("FIELD_TOO_LONG"))
                .andExpect(jsonPath("$.details.row").value(3));
    }

    @Test
    void nonUtf8StatementIsBadRequest() throws Exception {
        byte[] header = csv("Date,Merchant,Amount", "");
        byte[] content = new byte[header.length + 3];
        System.arraycopy(header, 0, content, 0, header.length);
        content[header.length] = (byte) 0xE0;
        content[header.length + 1] = (byte) 0xF9;
        content[header.length + 2] = (byte) 0xE5;
        MockMultipartFile file = new MockMultipartFile("file", "cp1255.csv", "text/csv", content);

        mockMvc.perform(multipart("/imports").file(file)
                        .param("account", "Visa 1234")
                        .param("period", "2024-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ENCODING"))
                .andExpect(jsonPath("$.details.line").value(2));
    }

    @Test
    void invalidPeriodIsBadRequest() throws Exception {
        MockMultipartFile file = statement("jan.csv", "Transaction Date,Merchant,Amount", "03/01/2024,Shop,-1.00");

        mockMvc.perform(multipart("/imports").file(file)
                        .param("account", "Visa 1234")
                        .param("period", "January"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void draftCanOnlyBeCommittedOnce() throws Exception {
        MockMultipartFile file = statement("feb.csv",
                "Transaction Date,Merchant,Amount,Category",
                "03/02/2024,Cafe Nero,-15.00,Dining",
                "04/02/2024,Shop,,");

        MvcResult created = mockMvc.perform(multipart("/imports/drafts").file(file)
                        .param("account", "Visa 1234")
                        .param("period", "2024-02"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.draft.status").value("PENDING"))
                .andExpect(jsonPath("$.draft.skippedRows").value(1))
                .andExpect(jsonPath("$.skipped[0].rowIndex").value(3))
                .andExpect(jsonPath("$.skipped[0].reason").value("empty amount"))
                .andReturn();
        String draftId = objectMapper.readTree(created.getResponse().getContentAsString()).get("draft").get("id").asText();

        MvcResult detail = mockMvc.perform(get("/imports/drafts/{id}", draftId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows[0].suggestedCategory").value("Dining"))
                .andReturn();
        JsonNode rows = objectMapper.readTree(detail.getResponse().getContentAsString()).get("rows");
        String rowId = rows.get(0).get("id").asText();

        mockMvc.perform(patch("/imports/drafts/{id}/rows/{rowId}", draftId, rowId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"Coffee\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approvedCategory").value("Coffee"));

        mockMvc.perform(post("/imports/drafts/{id}/commit", draftId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insertedRows").value(1));

        mockMvc.perform(post("/imports/drafts/{id}/commit", draftId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE"));

        mockMvc.perform(get("/counterparties/unmapped"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counterparties").isEmpty());
    }

    @Test
    void unknownBatchIsNotFound() throws Exception {
        mockMvc.perform(delete("/imports/{id}", "00000000-0000-0000-0000-000000000001"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    private static MockMultipartFile statement(String filename, String... lines) {
        return new MockMultipartFile("file", filename, "text/csv", csv(lines));
    }
}
