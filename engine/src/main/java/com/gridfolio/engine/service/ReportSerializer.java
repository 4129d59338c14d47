package com.gridfolio.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gridfolio.engine.exception.PortfolioEngineException;
import com.gridfolio.engine.model.AnalysisReport;
import org.springframework.stereotype.Service;

@Service
public class ReportSerializer {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(AnalysisReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new PortfolioEngineException("Could not render analysis report", e);
        }
    }

    public AnalysisReport fromJson(String json) {
        try {
            return objectMapper.readValue(json, AnalysisReport.class);
        } catch (JsonProcessingException e) {
            throw new PortfolioEngineException("Could not parse analysis report", e);
        }
    }
}
