package uk.gegc.formbatch.features.pdf.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import uk.gegc.formbatch.features.pdf.application.FormFillCapability;
import uk.gegc.formbatch.features.pdf.application.RowProcessor;
import uk.gegc.formbatch.features.pdf.application.RowValues;
import uk.gegc.formbatch.features.pdf.domain.exception.FormFillException;
import uk.gegc.formbatch.features.pdf.domain.model.CsvRow;
import uk.gegc.formbatch.features.pdf.domain.model.RowResult;
import uk.gegc.formbatch.features.pdf.domain.model.TemplateSource;
import uk.gegc.formbatch.features.storage.application.FileStore;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class RowProcessorImpl implements RowProcessor {

    private final FormFillCapability formFillCapability;
    private final FileStore fileStore;
    private final Executor formFillExecutor;
    private final long rowTimeoutMs;

    public RowProcessorImpl(FormFillCapability formFillCapability,
                            FileStore fileStore,
                            @Qualifier("formFillExecutor") Executor formFillExecutor,
                            @Value("${formbatch.batch.row-timeout-ms:30000}") long rowTimeoutMs) {
        this.formFillCapability = formFillCapability;
        this.fileStore = fileStore;
        this.formFillExecutor = formFillExecutor;
        this.rowTimeoutMs = rowTimeoutMs;
    }

    @Override
    public RowResult process(TemplateSource template, CsvRow row) {
        int rowIndex = row.rowIndex();
        String outputFileName = RowValues.outputFileName(row.values(), rowIndex);
        Map<String, String> values = RowValues.fieldValues(row.values());

        byte[] filled;
        FutureTask<byte[]> task = new FutureTask<>(() -> formFillCapability.fill(template.content(), values));
        try {
            formFillExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Row {} could not be scheduled for form filling: {}", rowIndex + 1, e.getMessage());
            return RowResult.failure(rowIndex, outputFileName, "Row could not be scheduled: " + e.getMessage());
        }
        try {
            filled = task.get(rowTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Row {} timed out after {} ms", rowIndex + 1, rowTimeoutMs);
            return RowResult.failure(rowIndex, outputFileName, "Row timed out after " + rowTimeoutMs + " ms");
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            return RowResult.failure(rowIndex, outputFileName, "Row processing interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof FormFillException) {
                log.warn("Row {} could not be filled: {}", rowIndex + 1, cause.getMessage());
            } else {
                log.error("Row {} failed unexpectedly", rowIndex + 1, cause);
            }
            return RowResult.failure(rowIndex, outputFileName, "Error processing row " + (rowIndex + 1) + ": " + cause.getMessage());
        }

        try {
            String outputRef = fileStore.store(filled, outputFileName);
            log.debug("Completed row {} as {}", rowIndex + 1, outputFileName);
            return RowResult.success(rowIndex, outputFileName, outputRef);
        } catch (RuntimeException e) {
            log.error("Row {} filled but could not be stored", rowIndex + 1, e);
            return RowResult.failure(rowIndex, outputFileName, "Failed to store output: " + e.getMessage());
        }
    }
}
