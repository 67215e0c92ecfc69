package com.keer.studiosync;

import org.springframework.stereotype.Component;
import org.springframework.test.web.servlet.MvcResult;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * 步驟之間共用的測試狀態：最近一次 HTTP 回應，以及匯出的備份與判別紀錄
 */
@Component
public class ScenarioContext {

    private final Map<String, Object> values = new HashMap<>();
    private MvcResult lastResponse;

    public void setLastResponse(MvcResult result) {
        this.lastResponse = result;
    }

    public MvcResult getLastResponse() {
        return lastResponse;
    }

    // MockMvc 預設以 ISO-8859-1 解碼，日文姓名必須指定 UTF-8
    public String lastResponseBody() throws UnsupportedEncodingException {
        if (lastResponse == null) {
            throw new IllegalStateException("尚未送出任何 HTTP 請求");
        }
        return lastResponse.getResponse().getContentAsString(StandardCharsets.UTF_8);
    }

    public void put(String key, Object value) {
        values.put(key, value);
    }

    public <T> T get(String key, Class<T> type) {
        return type.cast(values.get(key));
    }

    public void clear() {
        values.clear();
        lastResponse = null;
    }
}
