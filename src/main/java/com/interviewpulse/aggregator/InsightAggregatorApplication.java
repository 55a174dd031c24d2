package com.interviewpulse.aggregator;

import com.interviewpulse.aggregator.config.properties.AggregationProperties;
import com.interviewpulse.aggregator.config.properties.DeliveryProperties;
import com.interviewpulse.aggregator.config.properties.IngestProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AggregationProperties.class,
        IngestProperties.class,
        DeliveryProperties.class
})
public class InsightAggregatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(InsightAggregatorApplication.class, args);
    }

}
