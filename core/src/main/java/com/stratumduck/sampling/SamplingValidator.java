package com.stratumduck.sampling;

import com.stratumduck.backend.DataBackend;
import com.stratumduck.backend.RelationName;
import com.stratumduck.exception.EmptyInputException;
import com.stratumduck.exception.InvalidArgumentException;
import com.stratumduck.exception.RelationAlreadyExistsException;
import com.stratumduck.exception.RelationNotFoundException;
import com.stratumduck.exception.SchemaMismatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks the preconditions of a sampling request before any relation is
 * created.
 *
 * <p>Checks run in this order and stop at the first failure:
 * <ol>
 *   <li>source and output identifiers are non-empty ({@link InvalidArgumentException})</li>
 *   <li>the output does not exist ({@link RelationAlreadyExistsException})</li>
 *   <li>the source exists ({@link RelationNotFoundException})</li>
 *   <li>the source has rows ({@link EmptyInputException})</li>
 *   <li>the proportion is in (0, 1] ({@link InvalidArgumentException})</li>
 *   <li>every grouping key and target column exists ({@link SchemaMismatchException})</li>
 *   <li>a seeded request's source has no column named {@code rowid}
 *       ({@link InvalidArgumentException})</li>
 * </ol>
 *
 * <p>The validator only reads catalog metadata, so validating the same request
 * twice against an unchanged backend gives the same verdict.
 */
public class SamplingValidator {

    private static final String ROWID = "rowid";

    private final DataBackend backend;

    public SamplingValidator(DataBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    /**
     * Validates a request.
     *
     * @param request the request
     * @return the resolved relations, proportion and source schema
     * @throws com.stratumduck.exception.SamplingException describing the first failed check
     */
    public ValidatedRequest validate(SamplingRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        RelationName source = parseName("Source", request.source());
        RelationName output = parseName("Output", request.output());

        if (backend.relationExists(output)) {
            throw new RelationAlreadyExistsException(output.toString());
        }
        if (!backend.relationExists(source)) {
            throw new RelationNotFoundException(source.toString());
        }
        if (backend.isEmpty(source)) {
            throw new EmptyInputException(source.toString());
        }

        Proportion proportion = Proportion.of(request.proportion());

        SourceSchema schema = new SourceSchema(source, backend.columns(source));
        List<String> unknown = new ArrayList<>();
        for (String key : request.groupingKeys()) {
            collectUnknown(schema, key, unknown);
        }
        if (!ColumnProjector.isDefaultProjection(request.targetColumns())) {
            for (String column : request.targetColumns()) {
                collectUnknown(schema, column, unknown);
            }
        }
        if (!unknown.isEmpty()) {
            throw new SchemaMismatchException(source.toString(), unknown, schema.columns());
        }

        // seeded passes identify rows by the rowid pseudo-column, which a real column shadows
        Optional<String> shadowingColumn = schema.find(ROWID);
        if (request.seed().isPresent() && shadowingColumn.isPresent()) {
            throw new InvalidArgumentException("Seeded sampling is not supported on " + source
                + ": column \"" + shadowingColumn.get() + "\" hides the built-in rowid."
                + " Rename the column or sample without a seed");
        }

        return new ValidatedRequest(source, output, proportion, schema);
    }

    private static RelationName parseName(String role, String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException(role + " relation name must not be empty");
        }
        try {
            return RelationName.parse(name);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException(role + " relation name is invalid: " + e.getMessage());
        }
    }

    private static void collectUnknown(SourceSchema schema, String column, List<String> unknown) {
        if (column == null || column.isBlank()) {
            throw new InvalidArgumentException("Column names must not be empty");
        }
        if (schema.find(column).isEmpty() && !unknown.contains(column)) {
            unknown.add(column);
        }
    }

    /**
     * Outcome of a successful validation.
     */
    public static final class ValidatedRequest {
        private final RelationName source;
        private final RelationName output;
        private final Proportion proportion;
        private final SourceSchema schema;

        ValidatedRequest(RelationName source, RelationName output, Proportion proportion, SourceSchema schema) {
            this.source = source;
            this.output = output;
            this.proportion = proportion;
            this.schema = schema;
        }

        public RelationName source() {
            return source;
        }

        public RelationName output() {
            return output;
        }

        public Proportion proportion() {
            return proportion;
        }

        public SourceSchema schema() {
            return schema;
        }
    }
}
