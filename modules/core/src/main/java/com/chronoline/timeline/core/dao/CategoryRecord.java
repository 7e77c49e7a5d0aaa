package com.chronoline.timeline.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/** One node of the category hierarchy. {@code leaf} is true when no category names it as parent. */
public record CategoryRecord(
        @ColumnName("id") String id,
        @ColumnName("name") String name,
        @ColumnName("description") String description,
        @ColumnName("color") String color,
        @ColumnName("parent_id") String parentId,
        @ColumnName("leaf") boolean leaf
) {
}
