package im.arun.taxonomy.service;

import im.arun.taxonomy.runlog.RunLog;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * A completed run: the run log, the transformation result and the files written.
 */
@Value
public class EtlRunResult {
    RunLog runLog;
    PipelineResult pipelineResult;
    List<Path> runLogFiles;
    List<Path> outputFiles;
}
