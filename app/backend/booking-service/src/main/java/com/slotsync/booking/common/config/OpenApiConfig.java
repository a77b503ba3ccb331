package com.slotsync.booking.common.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 설정
 *
 * 소유자 API는 Gateway가 인증 후 주입하는 X-Cognito-Sub 헤더로 소유자를 식별한다.
 * 슬롯 조회와 예약 생성은 예약자용 공개 API라 헤더가 없다.
 */
@Configuration
public class OpenApiConfig {

    private static final String OWNER_HEADER_SCHEME = "ownerHeader";

    @Value("${springdoc.server.url:/api}")
    private String serverUrl;

    @Bean
    public OpenAPI bookingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Booking Service API")
                        .version("1.0.0")
                        .description("캘린더 설정, 이벤트 타입, 예약 가능 슬롯 조회 및 예약 API. "
                                + "모든 시각은 오프셋을 포함한 ISO-8601 형식이며 응답은 UTC로 반환합니다."))
                .components(new Components()
                        .addSecuritySchemes(OWNER_HEADER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Cognito-Sub")
                                .description("캘린더 소유자 Cognito Sub (Gateway 주입)")))
                .servers(List.of(new Server().url(serverUrl).description("API Gateway")));
    }
}
