package com.geojoin.joiner.config;

import com.geojoin.joiner.client.IdentifierPager;
import com.geojoin.joiner.client.LocalFileResultSink;
import com.geojoin.joiner.client.PointProvider;
import com.geojoin.joiner.client.PolygonMatcher;
import com.geojoin.joiner.client.ResultSink;
import com.geojoin.joiner.client.WfsPolygonMatcher;
import com.geojoin.joiner.service.BatchCoordinator;
import com.geojoin.joiner.service.RecordResolver;
import java.nio.file.Path;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class JoinerConfig {

    @Bean
    PolygonMatcher polygonMatcher(@Qualifier("polygonWebClient") WebClient polygonWebClient, JoinerProperties properties) {
        return new WfsPolygonMatcher(
            polygonWebClient,
            properties.getWfsEndpoint(),
            properties.getLayer(),
            properties.getGeometryField(),
            properties.getLayerId(),
            properties.getNsPrefix(),
            properties.getNsUrl(),
            properties.getSrsName(),
            properties.getRequestTimeout()
        );
    }

    @Bean
    ResultSink resultSink(JoinerProperties properties) {
        return new LocalFileResultSink(Path.of(properties.getOutputFile()));
    }

    @Bean
    ThreadPoolTaskExecutor resolutionExecutor(JoinerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getConcurrency());
        executor.setMaxPoolSize(properties.getConcurrency());
        executor.setThreadNamePrefix("resolver-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    RecordResolver recordResolver(PointProvider pointProvider, PolygonMatcher polygonMatcher, JoinerProperties properties) {
        return new RecordResolver(pointProvider, polygonMatcher, properties.getPredicate());
    }

    @Bean
    BatchCoordinator batchCoordinator(
        IdentifierPager identifierPager,
        RecordResolver recordResolver,
        ResultSink resultSink,
        @Qualifier("resolutionExecutor") ThreadPoolTaskExecutor resolutionExecutor,
        JoinerProperties properties
    ) {
        return new BatchCoordinator(
            identifierPager,
            recordResolver,
            resultSink,
            resolutionExecutor,
            properties.getStartPage(),
            properties.getStopPage(),
            properties.getPageSize(),
            properties.getConcurrency(),
            properties.getSequenceStart()
        );
    }
}
