package com.chronoline.timeline.core.dao;

import com.chronoline.timeline.types.SourceKind;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class SourceKindArgumentFactory extends AbstractArgumentFactory<SourceKind> {

    public SourceKindArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(SourceKind value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}
