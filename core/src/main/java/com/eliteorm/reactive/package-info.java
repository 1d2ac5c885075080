/**
 * Broadcasts the contents of a table to in-memory consumers whenever it is changed through
 * {@link com.eliteorm.reactive.EntityPublisher}.
 */
package com.eliteorm.reactive;
