package com.example.roadcare.config;

import io.r2dbc.postgresql.PostgresqlConnectionConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import io.r2dbc.postgresql.client.SSLMode;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.r2dbc.config.AbstractR2dbcConfiguration;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Configuration
@EnableR2dbcRepositories(basePackages = "com.example.roadcare.entity")
public class DatabaseConfig extends AbstractR2dbcConfiguration {

    @Value("${spring.r2dbc.url}")
    private String databaseUrl;

    @Value("${spring.r2dbc.username}")
    private String username;

    @Value("${spring.r2dbc.password}")
    private String password;

    @Override
    @Bean
    public ConnectionFactory connectionFactory() {
        log.info("配置R2DBC PostgreSQL连接: {}", databaseUrl);

        DatabaseUrlInfo urlInfo = parseR2dbcUrl(databaseUrl);

        PostgresqlConnectionConfiguration configuration = PostgresqlConnectionConfiguration.builder()
                .host(urlInfo.host)
                .port(urlInfo.port)
                .username(username)
                .password(password)
                .database(urlInfo.database)
                .schema(urlInfo.schema)
                .applicationName("roadcare-obsolescence")
                // 连接超时配置
                .connectTimeout(Duration.ofSeconds(30))
                .sslMode(urlInfo.sslMode)
                .build();

        log.info("PostgreSQL连接配置完成 - Host: {}:{}, Database: {}, Schema: {}, SSL: {}",
                urlInfo.host, urlInfo.port, urlInfo.database, urlInfo.schema, urlInfo.sslMode);

        return new PostgresqlConnectionFactory(configuration);
    }

    @Bean
    public ReactiveTransactionManager transactionManager(ConnectionFactory connectionFactory) {
        return new R2dbcTransactionManager(connectionFactory);
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    /**
     * 解析R2DBC URL
     */
    static DatabaseUrlInfo parseR2dbcUrl(String url) {
        DatabaseUrlInfo info = new DatabaseUrlInfo();

        try {
            // r2dbc:postgresql://localhost:5433/rcp_cd16?schema=public&sslMode=disable
            Pattern pattern = Pattern.compile("r2dbc:postgres(?:ql)?://([^:/]+)(?::(\\d+))?/([^?]+)(?:\\?(.+))?");
            Matcher matcher = pattern.matcher(url);

            if (matcher.matches()) {
                info.host = matcher.group(1);
                info.port = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 5432;
                info.database = matcher.group(3);

                // 解析查询参数
                String queryParams = matcher.group(4);
                if (queryParams != null) {
                    for (String param : queryParams.split("&")) {
                        String[] keyValue = param.split("=");
                        if (keyValue.length == 2) {
                            switch (keyValue[0]) {
                                case "schema":
                                    info.schema = keyValue[1];
                                    break;
                                case "sslMode":
                                    info.sslMode = SSLMode.fromValue(keyValue[1]);
                                    break;
                                default:
                                    log.debug("忽略未知连接参数: {}", keyValue[0]);
                            }
                        }
                    }
                }
            } else {
                log.warn("无法解析R2DBC URL: {}, 使用默认配置", url);
            }
        } catch (RuntimeException e) {
            log.error("解析R2DBC URL时出错: {}, 使用默认配置", e.getMessage());
            info = new DatabaseUrlInfo();
        }

        return info;
    }

    /**
     * 数据库URL信息
     */
    static class DatabaseUrlInfo {
        String host = "localhost";
        int port = 5432;
        String database = "roadcare";
        String schema = "public";
        SSLMode sslMode = SSLMode.DISABLE;
    }
}
