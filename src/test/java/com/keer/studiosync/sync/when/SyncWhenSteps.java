package com.keer.studiosync.sync.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keer.studiosync.ScenarioContext;
import com.keer.studiosync.TestConfig;
import com.keer.studiosync.sync.controller.WebhookController;
import com.keer.studiosync.sync.dto.AutomationSyncRequest;
import com.keer.studiosync.sync.dto.RawMessageRequest;
import io.cucumber.datatable.DataTable;
import io.cucumber.java.zh_tw.當;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

public class SyncWhenSteps {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ScenarioContext scenarioContext;

    @當("^送出主旨為「([^」]+)」的郵件進行判別:$")
    public void 送出郵件進行判別(String subject, String body) throws Exception {
        RawMessageRequest request = RawMessageRequest.builder()
                .subject(subject)
                .body(body)
                .build();

        MvcResult result = mockMvc.perform(
                post("/api/messages/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andReturn();
        scenarioContext.setLastResponse(result);
    }

    @當("執行郵件同步")
    public void 執行郵件同步() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/mail/sync")).andReturn();
        scenarioContext.setLastResponse(result);
    }

    @當("^執行排程入口同步 (-?\\d+) 天$")
    public void 執行排程入口同步(int days) throws Exception {
        MvcResult result = mockMvc.perform(
                post("/api/automation/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AutomationSyncRequest(days))))
                .andReturn();
        scenarioContext.setLastResponse(result);
    }

    @當("以正確密鑰推送以下預約:")
    public void 以正確密鑰推送預約(DataTable table) throws Exception {
        pushWebhook(TestConfig.WEBHOOK_SECRET, table);
    }

    @當("^以密鑰「([^」]+)」推送以下預約:$")
    public void 以指定密鑰推送預約(String secret, DataTable table) throws Exception {
        pushWebhook(secret, table);
    }

    private void pushWebhook(String secret, DataTable table) throws Exception {
        List<Map<String, Object>> reservations = new ArrayList<>();
        for (Map<String, String> row : table.asMaps()) {
            Map<String, Object> reservation = new LinkedHashMap<>(row);
            reservation.put("is_cancellation", Boolean.parseBoolean(row.get("is_cancellation")));
            reservations.add(reservation);
        }

        MvcResult result = mockMvc.perform(
                post("/api/webhook/reservations")
                        .header(WebhookController.SECRET_HEADER, secret)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("reservations", reservations))))
                .andReturn();
        scenarioContext.setLastResponse(result);
    }
}
