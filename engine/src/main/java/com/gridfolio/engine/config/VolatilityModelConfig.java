package com.gridfolio.engine.config;

import com.gridfolio.engine.service.risk.GarchVolatilityModel;
import com.gridfolio.engine.service.risk.SampleVarianceModel;
import com.gridfolio.engine.service.risk.VolatilityModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VolatilityModelConfig {

    @Bean(name = "primaryVolatilityModel")
    public VolatilityModel primaryVolatilityModel(RiskProperties riskProperties) {
        return new GarchVolatilityModel(riskProperties.getGarch());
    }

    @Bean(name = "fallbackVolatilityModel")
    public VolatilityModel fallbackVolatilityModel() {
        return new SampleVarianceModel();
    }
}
