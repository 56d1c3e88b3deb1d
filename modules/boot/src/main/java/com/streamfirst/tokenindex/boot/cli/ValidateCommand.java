package com.streamfirst.tokenindex.boot.cli;

import com.streamfirst.tokenindex.adapters.sqlite.WalletDirectoryNodeRegistry;
import com.streamfirst.tokenindex.application.NodeValidationReport;
import com.streamfirst.tokenindex.application.TokenValidator;
import com.streamfirst.tokenindex.boot.TokenIndexProperties;
import com.streamfirst.tokenindex.domain.NodeContext;
import com.streamfirst.tokenindex.ports.NodeRegistryPort;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Slf4j
@Component
@RequiredArgsConstructor
@Command(
        name = "validate",
        mixinStandardHelpOptions = true,
        description = "Check pending tokens of each node against the hash index; pin the genuine ones.")
public class ValidateCommand implements Callable<Integer> {

    private final TokenIndexProperties props;
    private final ObjectProvider<TokenValidator> validator;

    @Spec CommandSpec spec;

    @Option(names = "--wallets-path", paramLabel = "DIR", description = "Directory holding the nodeNNN folders.")
    Path walletsPath;

    @Option(names = "--node", paramLabel = "NAME", description = "Validate only this node.")
    String node;

    @Option(names = "--dry-run", description = "Report verdicts without pinning or touching the ledger.")
    boolean dryRun;

    @Option(names = "--parallelism", paramLabel = "N", description = "Nodes processed at the same time.")
    Integer parallelism;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Path wallets = walletsPath != null ? walletsPath : props.getValidator().getWalletsPath();
        NodeRegistryPort registry = new WalletDirectoryNodeRegistry(wallets);

        List<NodeContext> nodes;
        if (node != null) {
            Optional<NodeContext> found = registry.findNode(node);
            if (found.isEmpty()) {
                err.printf("Node %s not found under %s%n", node, wallets);
                err.flush();
                return 1;
            }
            nodes = List.of(found.get());
        } else {
            nodes = registry.listNodes();
            if (nodes.isEmpty()) {
                err.printf("No nodes found under %s%n", wallets);
                err.flush();
                return 1;
            }
        }
        if (dryRun) {
            log.info("Dry run: nothing will be pinned or written to the ledgers");
        }

        int nodeParallelism = parallelism != null ? parallelism : props.getValidator().getNodeParallelism();
        List<NodeValidationReport> reports = validator.getObject().processAll(nodes, dryRun, nodeParallelism);

        boolean failed = false;
        for (NodeValidationReport report : reports) {
            if (report.isNodeFailed()) {
                failed = true;
                out.printf("%s: FAILED (%s)%n", report.getNodeName(), report.getFailure());
                continue;
            }
            out.printf(
                    "%s: processed %d, admitted %d, rejected %d %s, errors %d, ledger update failures %d%n",
                    report.getNodeName(),
                    report.getProcessed(),
                    report.getAdmitted(),
                    report.getRejected(),
                    report.getRejectionsByReason(),
                    report.getErrors(),
                    report.getLedgerUpdateFailures());
        }
        out.flush();
        return failed ? 1 : 0;
    }
}
