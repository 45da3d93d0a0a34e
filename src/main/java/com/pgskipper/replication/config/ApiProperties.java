package com.pgskipper.replication.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials callers must present (HTTP basic authentication) to use the
 * admin API. Bound from {@code replication.api.*}; {@code application.yml}
 * maps {@code API_USER} and {@code API_PASSWORD} onto them.
 *
 * <p><b>Security</b>: the defaults exist for local runs only; deployments are
 * expected to override both.</p>
 */
@ConfigurationProperties(prefix = "replication.api")
public class ApiProperties {

    private String user = "logical-repl-user";

    private String password = "logical-repl-password";

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
}
