package me.golemcore.humanloop.adapter.inbound.web.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

/**
 * Serves the single-page demo client and its favicon from the classpath.
 */
@Configuration
public class WebFluxConfig {

    static final String INDEX_PAGE = "static/index.html";
    static final String FAVICON = "static/favicon.svg";
    static final MediaType SVG = MediaType.valueOf("image/svg+xml");

    @Bean
    public RouterFunction<ServerResponse> demoPage() {
        return RouterFunctions.route()
                .GET("/", request -> ServerResponse.ok()
                        .contentType(MediaType.TEXT_HTML)
                        .bodyValue(new ClassPathResource(INDEX_PAGE)))
                .GET("/favicon.ico", request -> ServerResponse.ok()
                        .contentType(SVG)
                        .bodyValue(new ClassPathResource(FAVICON)))
                .build();
    }
}
