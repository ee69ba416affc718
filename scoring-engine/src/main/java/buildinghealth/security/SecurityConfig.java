package buildinghealth.security;

import buildinghealth.config.ApiRoutes;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
@RequiredArgsConstructor
public class SecurityConfig {

    private final KeycloakJwtConverter keycloakJwtConverter;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(sess -> sess.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .authorizeHttpRequests(auth -> auth
                        // 1. PÚBLICO: documentación, métricas y feed en vivo
                        .requestMatchers(
                                ApiRoutes.API_DOCS + "/**",
                                ApiRoutes.SWAGGER_UI + "/**",
                                ApiRoutes.METRICS,
                                "/health",
                                ApiRoutes.WEBSOCKET + "/**"
                        ).permitAll()

                        // 2. INGESTA: los productores de sensores no se autentican
                        .requestMatchers(HttpMethod.POST,
                                ApiRoutes.SAMPLES,
                                ApiRoutes.LEGACY_SENSOR_DATA
                        ).permitAll()
                        .requestMatchers(HttpMethod.GET,
                                ApiRoutes.DATA,
                                ApiRoutes.MODELS + "/current"
                        ).permitAll()

                        // 3. ADMIN GLOBAL
                        .requestMatchers(ApiRoutes.ADMIN + "/**").hasRole(UserRole.ADMIN.name())

                        // 4. OPERACIONES sobre alertas
                        .requestMatchers(HttpMethod.POST,
                                ApiRoutes.ALERTS + "/*/ack",
                                ApiRoutes.ALERTS + "/*/resolve"
                        ).hasAnyRole(UserRole.alertHandlers())

                        // 5. DEFAULT
                        .anyRequest().authenticated()
                )

                .oauth2ResourceServer(oauth2 -> oauth2
                        .jwt(jwt -> jwt.jwtAuthenticationConverter(keycloakJwtConverter))
                );

        return http.build();
    }
}
