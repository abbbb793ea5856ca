package com.microservices.learningservice.config;

import com.microservices.learningservice.security.JwtTokenService;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.*;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * HS256 keys for the tokens this service issues to its own clients.
 */
@Configuration
public class JwtConfig {

    @Value("${learning.jwt.secret}")
    private String secret;

    @Value("${learning.jwt.issuer:learning-service}")
    private String issuer;

    @Bean
    public SecretKey jwtSecretKey() {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalStateException("learning.jwt.secret must be at least 32 bytes for HS256");
        }
        return new SecretKeySpec(bytes, "HmacSHA256");
    }

    @Bean
    public JwtEncoder jwtEncoder(SecretKey jwtSecretKey) {
        return new NimbusJwtEncoder(new ImmutableSecret<>(jwtSecretKey));
    }

    @Bean
    @Primary
    public JwtDecoder accessTokenDecoder(SecretKey jwtSecretKey) {
        return decoderFor(jwtSecretKey, JwtTokenService.ACCESS);
    }

    @Bean
    public JwtDecoder refreshTokenDecoder(SecretKey jwtSecretKey) {
        return decoderFor(jwtSecretKey, JwtTokenService.REFRESH);
    }

    private JwtDecoder decoderFor(SecretKey key, String tokenType) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        OAuth2TokenValidator<Jwt> validator = new DelegatingOAuth2TokenValidator<>(
                JwtValidators.createDefaultWithIssuer(issuer),
                new JwtClaimValidator<String>(JwtTokenService.CLAIM_TOKEN_TYPE, tokenType::equals));
        decoder.setJwtValidator(validator);
        return decoder;
    }
}
