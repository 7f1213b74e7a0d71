package com.assetintel.attribution.output;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.exception.StoreUnavailableException;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.store.AssetStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class IssueReportRouterTest {

    @Mock
    private AssetStore store;

    @Mock
    private CsvIssueWriter csvIssueWriter;

    private AttributorProperties properties;
    private IssueReportRouter router;
    private AttributionRun run;

    @BeforeEach
    void setUp() {
        properties = new AttributorProperties();
        router = new IssueReportRouter(store, csvIssueWriter, properties);
        run = AttributionRun.builder()
                .runId("r1")
                .startedAt(LocalDateTime.now())
                .status(AttributionRun.RunStatus.SUCCESS)
                .build();
    }

    @Test
    void storeModeRecordsRunAndIssues() {
        router.write(run);

        verify(store).recordRun(run);
        verify(store).recordIssues(run.getIssues());
        verifyNoInteractions(csvIssueWriter);
    }

    @Test
    void csvModeLeavesTheStoreAlone() {
        properties.getReport().setMode(AttributorProperties.Report.ReportMode.CSV);

        router.write(run);

        verify(csvIssueWriter).write(run);
        verifyNoInteractions(store);
    }

    @Test
    void sinkFailuresDoNotEscape() {
        properties.getReport().setMode(AttributorProperties.Report.ReportMode.BOTH);
        doThrow(new StoreUnavailableException("down", new RuntimeException())).when(store).recordRun(any());

        assertThatCode(() -> router.write(run)).doesNotThrowAnyException();
        verify(csvIssueWriter).write(run);
    }
}
