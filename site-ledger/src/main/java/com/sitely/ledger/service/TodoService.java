package com.sitely.ledger.service;

import com.sitely.ledger.exception.LedgerConstraintException;
import com.sitely.ledger.exception.RecordNotFoundException;
import com.sitely.ledger.model.TodoItem;
import com.sitely.ledger.model.TodoPriority;
import com.sitely.ledger.model.TodoType;
import com.sitely.ledger.model.TodoUpdate;
import com.sitely.ledger.repository.TodoRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static com.sitely.ledger.service.LedgerStore.newId;
import static com.sitely.ledger.service.LedgerStore.requireText;

@Service
@RequiredArgsConstructor
public class TodoService {

    private final StorageInitializer storageInitializer;
    private final LedgerTransactions transactions;
    private final Clock clock;
    private final TodoRepository todoRepository;

    public TodoItem createTodo(TodoItem todo) {
        requireText(todo.getTitle(), "Todo title");
        if (todo.getType() == null) {
            throw new LedgerConstraintException("Todo type is required");
        }
        storageInitializer.awaitReady();
        return transactions.write(() -> {
            TodoItem toInsert = todo.toBuilder()
                    .id(todo.getId() == null ? newId() : todo.getId())
                    .description(todo.getDescription() == null ? "" : todo.getDescription())
                    .priority(todo.getPriority() == null ? TodoPriority.MEDIUM : todo.getPriority())
                    .completedAt(todo.isCompleted() ? clock.instant() : null)
                    .createdAt(todo.getCreatedAt() == null ? clock.instant() : todo.getCreatedAt())
                    .build();
            todoRepository.insert(toInsert);
            return toInsert;
        });
    }

    /** Newest first; all types when type is null. */
    public List<TodoItem> listTodos(TodoType type) {
        storageInitializer.awaitReady();
        return type == null ? todoRepository.findAll() : todoRepository.findByType(type);
    }

    public Optional<TodoItem> findTodo(String todoId) {
        storageInitializer.awaitReady();
        return todoRepository.findById(todoId);
    }

    public TodoItem updateTodo(String todoId, TodoUpdate update) {
        storageInitializer.awaitReady();
        return transactions.write(() -> {
            if (todoRepository.update(todoId, update, clock.instant()) == 0) {
                throw new RecordNotFoundException(todoRepository.table(), todoId);
            }
            return todoRepository.findById(todoId)
                    .orElseThrow(() -> new RecordNotFoundException(todoRepository.table(), todoId));
        });
    }

    public void deleteTodo(String todoId) {
        storageInitializer.awaitReady();
        transactions.run(() -> {
            if (todoRepository.deleteById(todoId) == 0) {
                throw new RecordNotFoundException(todoRepository.table(), todoId);
            }
        });
    }
}
