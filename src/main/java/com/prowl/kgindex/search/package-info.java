/**
 * Query engine: hybrid retrieval over stored chunks, entities and relations.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code QueryService} - query contract</li>
 *   <li>{@code QueryServiceImpl} - vector ranking merged with entity and relation lookups</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.prowl.kgindex.search;
