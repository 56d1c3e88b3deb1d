package com.streamfirst.tokenindex.boot.cli;

import com.streamfirst.tokenindex.domain.Cid;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/** Operator helper: prints the CIDv0 wrapping a SHA-256 digest or a token content string. */
@Component
@Command(
        name = "hex-to-cid",
        mixinStandardHelpOptions = true,
        description = {
            "Print the CIDv0 (base58btc of the SHA2-256 multihash) of a 64-character hex digest.",
            "67-character token content is accepted too; its 3-digit level prefix is dropped.",
            "Whitespace is ignored, so the hex may be passed in several pieces."
        })
public class HexToCidCommand implements Callable<Integer> {

    @Spec CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "HEX", description = "Digest or token content.")
    List<String> hex;

    @Override
    public Integer call() {
        Cid cid;
        try {
            cid = Cid.v0FromSha256(String.join("", hex));
        } catch (IllegalArgumentException e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println(e.getMessage());
            err.flush();
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(cid);
        out.flush();
        return 0;
    }
}
