/**
 * The typed field-marshalling engine.
 *
 * <p>An {@link com.eliteorm.model.Entity} is an ordered list of {@link com.eliteorm.model.Field}s.
 * Each field converts its value to and from the representation a store accepts:
 *
 * <ul>
 *   <li>{@link com.eliteorm.model.ScalarField} - integers, longs, doubles and text, as is
 *   <li>{@link com.eliteorm.model.EnumField} - the constant's ordinal
 *   <li>{@link com.eliteorm.model.BoolField} - 1 or 0
 *   <li>{@link com.eliteorm.model.BinaryField} - raw bytes
 *   <li>{@link com.eliteorm.model.TimestampField} - ISO-8601 text
 *   <li>{@link com.eliteorm.model.DurationField} - microseconds
 *   <li>{@link com.eliteorm.model.ScalarListField} - JSON array text
 *   <li>{@link com.eliteorm.model.ObjectListField} - JSON array of objects
 *   <li>{@link com.eliteorm.model.ObjectField} - JSON object text
 * </ul>
 *
 * <p>Nested values implement {@link com.eliteorm.model.Mappable}; entities do so as well and may
 * therefore be nested in each other.
 */
package com.eliteorm.model;
