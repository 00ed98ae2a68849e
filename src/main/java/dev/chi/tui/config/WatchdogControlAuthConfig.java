package dev.chi.tui.config;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 注册 watchdog 控制接口鉴权 filter。
 */
@Configuration
public class WatchdogControlAuthConfig {

    @Bean
    public FilterRegistrationBean<WatchdogControlAuthFilter> watchdogControlAuthFilterRegistration(
            WatchdogControlAuthProperties props
    ) {
        FilterRegistrationBean<WatchdogControlAuthFilter> reg = new FilterRegistrationBean<>();
        reg.setFilter(new WatchdogControlAuthFilter(props));
        reg.addUrlPatterns("/api/chi/watchdog/*");
        reg.setOrder(1);
        return reg;
    }
}
