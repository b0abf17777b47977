package com.siat.siat_backend.generator.llm;

import com.siat.siat_backend.model.domain.LlmProvider;
import com.siat.siat_backend.model.llm.LlmRequest;
import com.siat.siat_backend.model.llm.LlmResponse;

import java.util.List;

public interface LlmClient {

    LlmProvider getProvider();

    // Never throws; transport and API failures come back as LlmResponse.error
    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    String getDefaultModel();

    List<String> getKnownModels();
}
