package com.voucherpay.api;

import com.voucherpay.api.config.AccessibilityProperties;
import com.voucherpay.api.config.AnalyticsProperties;
import com.voucherpay.api.config.CorsProperties;
import com.voucherpay.api.config.JwtProperties;
import com.voucherpay.api.config.ServiceProperties;
import com.voucherpay.api.config.TotpProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * VoucherPay Enterprise API.
 *
 * <p>Every request passes through the correlation filter, the security-header filter and the
 * middleware pipeline filter before reaching a controller. Authentication is per endpoint:
 * controllers that declare an {@link com.voucherpay.security.AuthenticatedUser} parameter
 * require a valid access token.
 */
@SpringBootApplication
@EnableConfigurationProperties({
    ServiceProperties.class,
    JwtProperties.class,
    TotpProperties.class,
    AccessibilityProperties.class,
    AnalyticsProperties.class,
    CorsProperties.class
})
public class VoucherPayApplication {

    private static final Logger log = LoggerFactory.getLogger(VoucherPayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(VoucherPayApplication.class, args);
        log.info("VoucherPay Enterprise API started");
    }
}
