package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.PrecisionLevel;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class PrecisionLevelColumnMapper implements ColumnMapper<PrecisionLevel> {

    @Override
    public PrecisionLevel map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String label = r.getString(columnNumber);
        return label == null ? null : PrecisionLevel.requireLabel(label);
    }
}
