/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.relationtools.annotations;

import net.scoreworks.relationtools.Record;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a one-to-many relation of the annotated record type. Declarations are read once per class and registered
 * on a record instance the first time the relation's accessor is used.
 * <pre>
 * &#64;HasMany(name = "items", child = OrderItem.class, foreignKey = "orderId")
 * public class Order extends RelationalRecord { ... }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(HasManyRelations.class)
public @interface HasMany {

    /**
     * Name of the relation, as used by the record's accessors
     */
    String name();

    Class<? extends Record> child();

    /**
     * Attribute of the child holding the parent's key
     */
    String foreignKey();

    /**
     * Attribute of the parent the foreign key refers to. Always the parent's primary key
     */
    String localKey() default "id";

    /**
     * Whether the relation takes part in cascaded deletes, bulk loading and deep cloning
     */
    boolean keepUpdated() default true;
}
