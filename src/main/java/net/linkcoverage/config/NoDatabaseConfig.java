package net.linkcoverage.config;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.context.annotation.Configuration;

/**
 * Memory-only mode: active when no database URL is configured.
 *
 * <p>DataSource auto-configuration is excluded so startup never attempts a connection, and the
 * in-memory campaign store and backlink record repository take over.</p>
 *
 * @see DatabaseConfig
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class,
        SqlInitializationAutoConfiguration.class
})
public class NoDatabaseConfig {

}
