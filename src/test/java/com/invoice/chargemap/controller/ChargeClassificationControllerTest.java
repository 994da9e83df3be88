package com.invoice.chargemap.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoice.chargemap.exception.RuleTablesNotLoadedException;
import com.invoice.chargemap.fixtures.TestFixtures;
import com.invoice.chargemap.model.*;
import com.invoice.chargemap.service.DocumentAiLineItemParser;
import com.invoice.chargemap.service.LineItemClassificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChargeClassificationController Tests")
class ChargeClassificationControllerTest {

    @Mock private LineItemClassificationService classificationService;
    @Mock private DocumentAiLineItemParser documentParser;

    private MockMvc mockMvc;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ChargeClassificationController(classificationService, documentParser))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static ClassifiedLineItem classified(LineItem item) {
        return ClassifiedLineItem.builder()
                .lineItem(item)
                .normalizedText("30YD COMPACTOR OCC HAUL")
                .parsedEquipment("30YD Compactor")
                .parsedMaterial("OCC")
                .chargeType("Empty & Return")
                .serviceType("On Call")
                .matchTier(MatchTier.VENDOR_SPECIFIC)
                .matchedRuleId(105L)
                .resolution(ServiceResolution.Status.RESOLVED)
                .resolvedServiceId("73913")
                .candidateServiceIds(List.of("73913"))
                .build();
    }

    @Test
    @DisplayName("POST /classify returns classified lines with their tier label")
    void shouldClassifyLineItems() throws Exception {
        LineItem item = TestFixtures.line(TestFixtures.LAWRENCE, TestFixtures.ACCOUNT, "30YD COMPACTOR OCC HAUL");
        List<ClassifiedLineItem> items = List.of(classified(item));
        when(classificationService.classifyAll(anyList()))
                .thenReturn(new ClassificationBatchResult(4L, items, ClassificationReport.summarize(items, 10)));

        mockMvc.perform(post("/api/charges/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(item))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshotVersion").value(4))
                .andExpect(jsonPath("$.items[0].chargeType").value("Empty & Return"))
                .andExpect(jsonPath("$.items[0].matchTier").value("vendor-specific"))
                .andExpect(jsonPath("$.items[0].resolution").value("RESOLVED"))
                .andExpect(jsonPath("$.items[0].resolvedServiceId").value("73913"))
                .andExpect(jsonPath("$.items[0].lineItem.vendorName").value("Lawrence Waste"))
                .andExpect(jsonPath("$.report.coverage").value(100.0));
    }

    @Test
    @DisplayName("POST /classify/document parses and classifies the upload")
    void shouldClassifyDocument() throws Exception {
        InvoiceDocument document = new InvoiceDocument();
        document.setInvoiceNumber("INV-5501");
        DocumentClassificationResult result = DocumentClassificationResult.of(document,
                new ClassificationBatchResult(1L, List.of(), ClassificationReport.summarize(List.of(), 10)));

        when(documentParser.parse(anyString(), eq("Lawrence Waste"))).thenReturn(document);
        when(classificationService.classifyDocument(document)).thenReturn(result);

        MockMultipartFile file = new MockMultipartFile(
                "file", "invoice.json", "application/json", "{\"entities\":[]}".getBytes());

        mockMvc.perform(multipart("/api/charges/classify/document").file(file).param("vendor", "Lawrence Waste"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invoiceNumber").value("INV-5501"))
                .andExpect(jsonPath("$.status").value("EMPTY"));
    }

    @Test
    @DisplayName("POST /classify/document rejects unparseable JSON with 400")
    void shouldRejectInvalidDocument() throws Exception {
        when(documentParser.parse(anyString(), any()))
                .thenThrow(new IllegalArgumentException("Document is not valid JSON: oops"));

        MockMultipartFile file = new MockMultipartFile("file", "bad.json", "application/json", "oops".getBytes());

        mockMvc.perform(multipart("/api/charges/classify/document").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Document is not valid JSON: oops"));
        verifyNoInteractions(classificationService);
    }

    @Test
    @DisplayName("POST /classify/document rejects an empty upload")
    void shouldRejectEmptyUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.json", "application/json", new byte[0]);

        mockMvc.perform(multipart("/api/charges/classify/document").file(file))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(documentParser, classificationService);
    }

    @Test
    @DisplayName("POST /classify/document answers 503 before the rule tables are loaded")
    void shouldReportNotLoadedForDocument() throws Exception {
        InvoiceDocument document = new InvoiceDocument();
        when(documentParser.parse(anyString(), any())).thenReturn(document);
        when(classificationService.classifyDocument(document)).thenThrow(new RuleTablesNotLoadedException());

        MockMultipartFile file = new MockMultipartFile("file", "x.json", "application/json", "{}".getBytes());

        mockMvc.perform(multipart("/api/charges/classify/document").file(file))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Rule tables have not been loaded yet"));
    }

    @Test
    @DisplayName("POST /classify/document reports unexpected failures in the result")
    void shouldReportUnexpectedFailure() throws Exception {
        InvoiceDocument document = new InvoiceDocument();
        when(documentParser.parse(anyString(), any())).thenReturn(document);
        when(classificationService.classifyDocument(document)).thenThrow(new RuntimeException("boom"));

        MockMultipartFile file = new MockMultipartFile("file", "x.json", "application/json", "{}".getBytes());

        mockMvc.perform(multipart("/api/charges/classify/document").file(file))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.warnings[0]").value("boom"));
    }
}
