package org.iceforge.efsguard.jdbc;

import org.iceforge.efsguard.lock.LockManagerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JdbcConfig {

    /**
     * Default factory (DriverManager). Deployments can override by providing their own bean.
     */
    @Bean
    public ConnectionFactory connectionFactory(EfsGuardJdbcProperties props) {
        return new DriverManagerConnectionFactory(props);
    }

    @Bean
    public GuardedDataSource guardedDataSource(ConnectionFactory connectionFactory,
                                               LockManagerFactory lockManagerFactory,
                                               EfsGuardJdbcProperties props) {
        GuardedDataSource dataSource = new GuardedDataSource(connectionFactory, lockManagerFactory, props.resolveInitStatements());
        if (props.getLoginTimeout() > 0) {
            dataSource.setLoginTimeout(props.getLoginTimeout());
        }
        return dataSource;
    }
}
