package com.chronoline.timeline.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.Optional;

@RegisterConstructorMapper(CategoryRecord.class)
public interface CategoryDao {

    @SqlQuery("""
            SELECT c.id, c.name, c.description, c.color, c.parent_id,
                   NOT EXISTS (SELECT 1 FROM categories k WHERE k.parent_id = c.id) AS leaf
            FROM categories c
            WHERE c.id = :id
            """)
    Optional<CategoryRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT COUNT(*) FROM categories")
    int count();
}
