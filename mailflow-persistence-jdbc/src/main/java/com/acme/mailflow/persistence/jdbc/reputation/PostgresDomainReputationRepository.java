package com.acme.mailflow.persistence.jdbc.reputation;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresDomainReputationRepository extends JdbcDomainReputationRepository {

    public PostgresDomainReputationRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getRecordSentSql() {
        return """
                INSERT INTO domain_reputation (domain_id, total_sent, total_delivered, created_at, updated_at)
                VALUES (?, 1, 1, ?, ?)
                ON CONFLICT (domain_id) DO UPDATE
                SET total_sent = domain_reputation.total_sent + 1,
                    total_delivered = domain_reputation.total_delivered + 1,
                    updated_at = EXCLUDED.updated_at
                """;
    }
}
