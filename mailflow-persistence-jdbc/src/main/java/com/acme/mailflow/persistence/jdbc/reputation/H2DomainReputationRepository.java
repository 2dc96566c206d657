package com.acme.mailflow.persistence.jdbc.reputation;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DomainReputationRepository extends JdbcDomainReputationRepository {

    public H2DomainReputationRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getRecordSentSql() {
        return """
                MERGE INTO domain_reputation t
                USING (SELECT CAST(? AS VARCHAR(64)) AS domain_id,
                              CAST(? AS TIMESTAMP) AS created_ts,
                              CAST(? AS TIMESTAMP) AS updated_ts) s
                ON t.domain_id = s.domain_id
                WHEN MATCHED THEN UPDATE
                    SET total_sent = t.total_sent + 1,
                        total_delivered = t.total_delivered + 1,
                        updated_at = s.updated_ts
                WHEN NOT MATCHED THEN INSERT (domain_id, total_sent, total_delivered, created_at, updated_at)
                    VALUES (s.domain_id, 1, 1, s.created_ts, s.updated_ts)
                """;
    }
}
