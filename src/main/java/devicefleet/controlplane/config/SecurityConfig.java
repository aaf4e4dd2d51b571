package devicefleet.controlplane.config;

import devicefleet.controlplane.auth.SignatureAuthenticator;
import devicefleet.controlplane.security.SignatureAuthenticationFilter;
import java.util.List;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
public class SecurityConfig {

    @Bean
    public SignatureAuthenticationFilter signatureAuthenticationFilter(
        SignatureAuthenticator authenticator,
        AuthProperties authProperties
    ) {
        return new SignatureAuthenticationFilter(authenticator, authProperties);
    }

    /**
     * The filter runs inside the security chain only; keep Boot from also mounting it on the servlet.
     */
    @Bean
    public FilterRegistrationBean<SignatureAuthenticationFilter> signatureFilterRegistration(
        SignatureAuthenticationFilter filter
    ) {
        FilterRegistrationBean<SignatureAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(
        HttpSecurity http,
        SignatureAuthenticationFilter signatureAuthenticationFilter
    ) throws Exception {
        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            // requests are HMAC-signed and replay-protected; there is no cookie session to forge
            .csrf(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .addFilterBefore(signatureAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
            .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(List.of("*"));
        configuration.setAllowedMethods(List.of(
            HttpMethod.GET.name(), HttpMethod.POST.name(), HttpMethod.PUT.name(),
            HttpMethod.DELETE.name(), HttpMethod.OPTIONS.name()));
        configuration.setAllowedHeaders(List.of(
            "Content-Type", "Authorization",
            SignatureAuthenticationFilter.TS_HEADER,
            SignatureAuthenticationFilter.NONCE_HEADER,
            SignatureAuthenticationFilter.SIGN_HEADER));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
