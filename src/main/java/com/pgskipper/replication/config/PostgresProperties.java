package com.pgskipper.replication.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the PostgreSQL cluster the controller administers.
 *
 * <h2>Binding</h2>
 * Properties are bound from Spring Boot config using the prefix
 * {@code replication.postgres}, e.g.:
 * <pre>
 * replication:
 *   postgres:
 *     host: pg-patroni
 *     port: 5432
 *     admin-user: postgres
 *     admin-password: ...
 *     default-database: postgres
 *     ssl: on
 *     connect-timeout: 20s
 *     health-timeout: 20s
 *     startup-check: true
 * </pre>
 * {@code application.yml} maps the deployment environment variables
 * ({@code POSTGRES_HOST}, {@code POSTGRES_PORT}, {@code POSTGRES_ADMIN_USER},
 * {@code POSTGRES_ADMIN_PASSWORD}, {@code PG_SSL}, {@code PG_CONN_TIMEOUT_SEC})
 * onto these keys.
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>The credentials are the cluster-wide admin credentials; every connection
 *       the controller opens uses them unless a caller passes its own.</li>
 *   <li>The password is a secret: it is never logged.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "replication.postgres")
public class PostgresProperties {

    /** Cluster host name or address. Default: {@code 127.0.0.1}. */
    private String host = "127.0.0.1";

    /** Cluster port. Default: {@code 5432}. */
    private int port = 5432;

    /** Admin role used for catalog lookups and DDL. Default: {@code postgres}. */
    private String adminUser = "postgres";

    /** Password of {@link #adminUser}. */
    private String adminPassword = "";

    /**
     * Database used when a request does not name one: health probes and role
     * grants. Default: {@code postgres}.
     */
    private String defaultDatabase = "postgres";

    /**
     * Require TLS on database connections ({@code sslmode=require}).
     *
     * <p>Accepts {@code on}/{@code off} as well as {@code true}/{@code false}.
     * Default: off.</p>
     */
    private boolean ssl = false;

    /** Time allowed to establish one connection. Default: 20s. */
    private Duration connectTimeout = Duration.ofSeconds(20);

    /** Time budget of one health probe, connection included. Default: 20s. */
    private Duration healthTimeout = Duration.ofSeconds(20);

    /**
     * Run a health probe during startup and refuse to start when the cluster
     * is unreachable. Default: true.
     */
    private boolean startupCheck = true;

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getAdminUser() { return adminUser; }
    public void setAdminUser(String adminUser) { this.adminUser = adminUser; }

    public String getAdminPassword() { return adminPassword; }
    public void setAdminPassword(String adminPassword) { this.adminPassword = adminPassword; }

    public String getDefaultDatabase() { return defaultDatabase; }
    public void setDefaultDatabase(String defaultDatabase) { this.defaultDatabase = defaultDatabase; }

    public boolean isSsl() { return ssl; }
    public void setSsl(boolean ssl) { this.ssl = ssl; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getHealthTimeout() { return healthTimeout; }
    public void setHealthTimeout(Duration healthTimeout) { this.healthTimeout = healthTimeout; }

    public boolean isStartupCheck() { return startupCheck; }
    public void setStartupCheck(boolean startupCheck) { this.startupCheck = startupCheck; }
}
