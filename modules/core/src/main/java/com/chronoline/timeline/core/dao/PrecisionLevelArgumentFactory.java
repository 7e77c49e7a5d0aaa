package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.PrecisionLevel;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class PrecisionLevelArgumentFactory extends AbstractArgumentFactory<PrecisionLevel> {

    public PrecisionLevelArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(PrecisionLevel value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}
