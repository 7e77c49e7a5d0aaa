package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.SourceKind;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class SourceKindColumnMapper implements ColumnMapper<SourceKind> {

    @Override
    public SourceKind map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String label = r.getString(columnNumber);
        return label == null ? null : SourceKind.requireLabel(label);
    }
}
