package net.findmycard.config;

import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Database wiring used when {@code spring.datasource.url} is set.
 *
 * <p>Imports the JDBC auto-configuration explicitly so the {@code card_printings} schema
 * script runs and {@link net.findmycard.repository.JdbcCardPrintingRepository} gets its
 * {@link JdbcTemplate} and transaction manager. {@link NoDatabaseConfig} covers the
 * opposite case.</p>
 *
 * @see NoDatabaseConfig
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
@ImportAutoConfiguration({
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class,
        SqlInitializationAutoConfiguration.class
})
public class DatabaseConfig {

    @Bean
    @ConditionalOnMissingBean(JdbcTemplate.class)
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }
}
