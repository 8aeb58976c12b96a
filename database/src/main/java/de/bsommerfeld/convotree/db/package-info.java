/**
 * Persistence layer for conversation trees, backed by SQLite.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [MessageTreeService / TopicService]
 *        │
 *        ▼
 *   TreeStore        ← read(work) / write(work), one connection per call
 *        │
 *        ▼
 *   StoreSession     ← every storage operation, bound to that connection
 *        │
 *   SqlTreeStore + SqlStoreSession (JDBC, sql/*.sql)
 * </pre>
 *
 * A {@link de.bsommerfeld.convotree.db.StoreSession} is the transaction scope:
 * whatever a {@link de.bsommerfeld.convotree.db.StoreWork} does through it
 * inside {@code write} commits or rolls back as one unit.
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ topic                                                            │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ UUID                                          │
 * │ name             │ Optional display name                         │
 * │ active_node_id   │ Tip of the displayed branch, nullable         │
 * │ created_at       │ Epoch millis                                  │
 * │ updated_at       │ Epoch millis                                  │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ message (Node + Hierarchy)                                       │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ UUID                                          │
 * │ topic_id         │ Owning topic                                  │
 * │ parent_id        │ Parent message, NULL for the root             │
 * │ role             │ user / assistant / system                     │
 * │ data             │ JSON payload ({"blocks": [...]})              │
 * │ searchable_text  │ Text blocks joined by newline, for search     │
 * │ status           │ pending / success / error / paused            │
 * │ siblings_group_id│ 0 = ungrouped                                 │
 * │ assistant_*, model_*, trace_id, stats │ pass-through metadata    │
 * │ created_at       │ Epoch millis, drives sibling order            │
 * │ updated_at       │ Epoch millis                                  │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * There are no foreign keys. Same-topic parents, the single root and
 * acyclicity are enforced by the tree service inside its transactions.
 *
 * <h2>Recursive Traversal</h2>
 * The parent graph is walked with recursive CTEs, never by loading a whole
 * topic:
 *
 * <pre>
 * WITH RECURSIVE descendants AS (
 *     SELECT id FROM message WHERE parent_id = ?
 *     UNION ALL
 *     SELECT m.id FROM message m
 *     INNER JOIN descendants d ON m.parent_id = d.id
 * )
 * SELECT id FROM descendants
 * </pre>
 *
 * <ul>
 * <li>{@code select-path-to-root.sql} walks upwards, root first</li>
 * <li>{@code select-descendant-ids.sql} walks downwards for cascades and
 * cycle checks</li>
 * <li>{@code select-subtree.sql} walks downwards with a depth bound for tree
 * views</li>
 * </ul>
 *
 * Batch lookups bind a JSON array and expand it with {@code json_each}:
 * {@code select-nodes-and-children.sql} and {@code select-siblings.sql}.
 */
package de.bsommerfeld.convotree.db;
