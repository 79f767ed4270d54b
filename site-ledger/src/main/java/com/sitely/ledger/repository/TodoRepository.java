package com.sitely.ledger.repository;

import com.sitely.ledger.model.TodoItem;
import com.sitely.ledger.model.TodoPriority;
import com.sitely.ledger.model.TodoType;
import com.sitely.ledger.model.TodoUpdate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class TodoRepository extends JdbcRepositorySupport {

    private static final RowMapper<TodoItem> ROW_MAPPER = (rs, rowNum) -> TodoItem.builder()
            .id(rs.getString("id"))
            .title(rs.getString("title"))
            .description(rs.getString("description"))
            .type(TodoType.fromCode(rs.getString("todo_type")))
            .deadline(localDate(rs, "deadline"))
            .completed(rs.getBoolean("completed"))
            .completedAt(instant(rs, "completed_at"))
            .priority(TodoPriority.fromCode(rs.getString("priority")))
            .siteId(rs.getString("site_id"))
            .createdAt(instant(rs, "created_at"))
            .build();

    public TodoRepository(JdbcTemplate jdbcTemplate) {
        super(jdbcTemplate, "todos");
    }

    public void insert(TodoItem todo) {
        jdbcTemplate.update("""
                INSERT INTO todos
                (id, title, description, todo_type, deadline, completed, completed_at, priority, site_id, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                todo.getId(),
                todo.getTitle(),
                text(todo.getDescription()),
                todo.getType().code(),
                sqlDate(todo.getDeadline()),
                todo.isCompleted(),
                sqlTimestamp(todo.getCompletedAt()),
                (todo.getPriority() == null ? TodoPriority.MEDIUM : todo.getPriority()).code(),
                todo.getSiteId(),
                sqlTimestamp(todo.getCreatedAt()));
    }

    public Optional<TodoItem> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM todos WHERE id = ?", ROW_MAPPER, id)
                .stream().findFirst();
    }

    public List<TodoItem> findAll() {
        return jdbcTemplate.query("SELECT * FROM todos ORDER BY created_at DESC", ROW_MAPPER);
    }

    public List<TodoItem> findByType(TodoType type) {
        return jdbcTemplate.query(
                "SELECT * FROM todos WHERE todo_type = ? ORDER BY created_at DESC", ROW_MAPPER, type.code());
    }

    /**
     * Completing stamps completed_at with {@code now}; re-opening clears it.
     */
    public int update(String id, TodoUpdate update, Instant now) {
        PartialUpdate sql = partialUpdate()
                .set("title", update.getTitle())
                .set("description", update.getDescription())
                .set("deadline", sqlDate(update.getDeadline()))
                .set("priority", update.getPriority() == null ? null : update.getPriority().code());
        if (update.getCompleted() != null) {
            sql.set("completed", update.getCompleted())
                    .setAlways("completed_at", update.getCompleted() ? sqlTimestamp(now) : null);
        }
        return sql.execute(jdbcTemplate, id);
    }
}
