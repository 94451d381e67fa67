package com.manna.ledger.config;

import com.manna.ledger.security.AuthenticatedUserFilter;
import com.manna.ledger.security.AuthenticatedUserProvider;
import com.manna.ledger.security.JsonAuthErrorHandlers;
import com.manna.ledger.security.TraceIdFilter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtDecoders;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    SecurityFilterChain securityFilterChain(
            HttpSecurity http,
            TraceIdFilter traceIdFilter,
            JwtAuthenticationConverter jwtAuthenticationConverter,
            AuthenticatedUserProvider authenticatedUserProvider,
            JsonAuthErrorHandlers jsonAuthErrorHandlers
    ) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(registry -> registry
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers("/healthz").permitAll()
                        .requestMatchers("/actuator/health/liveness").permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                )
                .oauth2ResourceServer(resource -> resource
                        .authenticationEntryPoint(jsonAuthErrorHandlers)
                        .accessDeniedHandler(jsonAuthErrorHandlers)
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtAuthenticationConverter))
                );

        http.addFilterBefore(traceIdFilter, UsernamePasswordAuthenticationFilter.class);
        http.addFilterAfter(new AuthenticatedUserFilter(authenticatedUserProvider), BearerTokenAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    JwtAuthenticationConverter jwtAuthenticationConverter() {
        JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
        converter.setPrincipalClaimName("sub");
        converter.setJwtGrantedAuthoritiesConverter(jwt -> List.of());
        return converter;
    }

    @Bean
    public JwtDecoder jwtDecoder(LedgerProperties properties) {
        LedgerProperties.Security security = properties.security();
        if (security.hasIssuerUri()) {
            log.info("Security: using issuer {}", security.issuerUri());
            return JwtDecoders.fromIssuerLocation(security.issuerUri());
        }
        if (security.hasDevJwtSecret()) {
            log.warn("Security: no issuer configured; validating bearer tokens with the shared dev secret");
            SecretKeySpec key = new SecretKeySpec(security.devJwtSecret().getBytes(StandardCharsets.UTF_8), "HmacSHA256");
            NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                    .macAlgorithm(MacAlgorithm.HS256)
                    .build();
            decoder.setJwtValidator(token -> OAuth2TokenValidatorResult.success());
            return decoder;
        }
        throw new IllegalStateException("Neither manna.security.issuer-uri nor manna.security.dev-jwt-secret is configured");
    }
}
