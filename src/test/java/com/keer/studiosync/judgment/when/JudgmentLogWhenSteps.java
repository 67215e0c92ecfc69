package com.keer.studiosync.judgment.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keer.studiosync.ScenarioContext;
import com.keer.studiosync.judgment.dto.ManualLogRequest;
import io.cucumber.java.zh_tw.當;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;

public class JudgmentLogWhenSteps {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ScenarioContext scenarioContext;

    @當("^管理者新增判別紀錄「(.*)」$")
    public void 管理者新增判別紀錄(String message) throws Exception {
        MvcResult result = mockMvc.perform(
                post("/api/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ManualLogRequest(message))))
                .andReturn();
        scenarioContext.setLastResponse(result);
    }

    @當("管理者匯出判別紀錄")
    public void 管理者匯出判別紀錄() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/logs/export")).andReturn();
        scenarioContext.setLastResponse(result);
        scenarioContext.put("exportedLog", scenarioContext.lastResponseBody());
    }

    @當("管理者清除判別紀錄")
    public void 管理者清除判別紀錄() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/logs/clear")).andReturn();
        scenarioContext.setLastResponse(result);
    }

    @當("管理者匯入先前匯出的判別紀錄")
    public void 管理者匯入先前匯出的判別紀錄() throws Exception {
        importText(scenarioContext.get("exportedLog", String.class));
    }

    @當("^管理者匯入內容為「(.+)」的判別紀錄$")
    public void 管理者匯入判別紀錄(String text) throws Exception {
        importText(text);
    }

    private void importText(String text) throws Exception {
        MvcResult result = mockMvc.perform(
                post("/api/logs/import")
                        .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                        .content(text))
                .andReturn();
        scenarioContext.setLastResponse(result);
    }
}
