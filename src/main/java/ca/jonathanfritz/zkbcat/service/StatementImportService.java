package ca.jonathanfritz.zkbcat.service;

import ca.jonathanfritz.zkbcat.exception.SecureFileException;
import ca.jonathanfritz.zkbcat.exception.ZkbCatException;
import ca.jonathanfritz.zkbcat.parser.ParseCoordinator;
import ca.jonathanfritz.zkbcat.parser.StatementValidator;
import ca.jonathanfritz.zkbcat.parser.ValidationResult;
import ca.jonathanfritz.zkbcat.secure.SecureDocumentGateway;
import ca.jonathanfritz.zkbcat.transactions.ParseResult;
import ca.jonathanfritz.zkbcat.utils.PathUtils;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * The entry point for hosts that import statements. Every document is only ever read through the
 * {@link SecureDocumentGateway}, so parsing and validation always work on a protected copy that is destroyed before
 * the call returns.
 * <p>
 * Importing is a dry run followed by a confirmation: {@link #parseStatement(Path)} produces a {@link ParseResult} for
 * the user to review, and {@link #confirm(ParseResult, TransactionSink)} hands the reviewed transactions to storage.
 */
public class StatementImportService {

    private static final Logger logger = LogManager.getLogger(StatementImportService.class);

    private final SecureDocumentGateway secureDocumentGateway;
    private final ParseCoordinator parseCoordinator;
    private final StatementValidator statementValidator;

    @Inject
    public StatementImportService(SecureDocumentGateway secureDocumentGateway, ParseCoordinator parseCoordinator,
                                  StatementValidator statementValidator) {
        this.secureDocumentGateway = secureDocumentGateway;
        this.parseCoordinator = parseCoordinator;
        this.statementValidator = statementValidator;
    }

    /**
     * Parses a user-selected statement document
     *
     * @param original the document the user selected. It is never modified
     * @return the parse result, labelled with the original file name
     * @throws SecureFileException if the document is missing, too large, of the wrong type, or cannot be staged
     */
    public ParseResult parseStatement(Path original) throws ZkbCatException {
        logger.debug("Parsing statement");
        final ParseResult parseResult = secureDocumentGateway.withSecureAccess(original, parseCoordinator::parseStatement);
        return parseResult.withSourceName(PathUtils.getFileName(original));
    }

    /**
     * Checks whether a user-selected document looks like a statement, without parsing it.
     * Gateway failures are reported as an invalid result rather than thrown.
     */
    public ValidationResult validateStatement(Path original) {
        try {
            return secureDocumentGateway.withSecureAccess(original, statementValidator::validate);
        } catch (ZkbCatException e) {
            logger.debug("Statement validation failed with {}", e.getKind());
            return ValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * Hands the transactions of a reviewed parse result to storage. Does nothing if the result has no transactions.
     *
     * @throws IllegalStateException if the parse failed structurally
     */
    public void confirm(ParseResult parseResult, TransactionSink transactionSink) {
        if (parseResult.isStructuralFailure()) {
            throw new IllegalStateException("Cannot confirm a failed parse of " + parseResult.getSourceName());
        }
        if (parseResult.getTransactions().isEmpty()) {
            logger.info("Nothing to confirm for {}", parseResult.getSourceName());
            return;
        }

        transactionSink.store(parseResult.getTransactions());
        logger.info("Confirmed {} transactions from {}", parseResult.getTransactions().size(), parseResult.getSourceName());
    }

    /**
     * Destroys any staged copies that were left behind, i.e. when the host is about to be backgrounded
     *
     * @return the number of files that were destroyed
     */
    public int clearSensitiveFiles() throws SecureFileException {
        return secureDocumentGateway.cleanupStagingDirectory();
    }
}
