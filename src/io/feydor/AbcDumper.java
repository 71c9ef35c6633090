package io.feydor;

import io.feydor.abc.Abc;
import io.feydor.abc.fmt.Stringifier;
import io.feydor.abc.tree.Expr.Tune;
import io.feydor.abc.tree.Token;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Dumps the tokens (and the systems of every tune) in an ABC file
 */
public class AbcDumper {
    public static void main(String[] args) {
        if (args.length < 1) {
            System.out.println("\nCOOL ABC Dumper\n\nUsage: abcdump [ABC File]\n\n");
            return;
        }

        System.out.print(dump(args[0]));
    }

    static String dump(String abcFile) {
        Abc abc;
        try {
            abc = Abc.read(new File(abcFile));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        var out = new StringBuilder();
        out.append(String.format("filename: %s\ntokens: %d\ndiagnostics: %d\n", abc.filename, abc.getTokens().size(),
                abc.getErrors().size()));
        for (var error : abc.getErrors()) {
            out.append("  ").append(error).append('\n');
        }

        out.append("Line|Col|Type|Lexeme\n");
        for (var token : abc.getTokens()) {
            out.append(formatToken(token)).append('\n');
        }

        if (abc.isParsed()) {
            var stringifier = new Stringifier();
            List<Tune> tunes = abc.getTree().tunes();
            for (int i = 0; i < tunes.size(); i++) {
                var tune = tunes.get(i);
                out.append(String.format("Tune %d voices=%s\n", i + 1, tune.header().voices()));
                if (tune.body() == null) {
                    continue;
                }
                var systems = tune.body().systems();
                for (int s = 0; s < systems.size(); s++) {
                    out.append(String.format("  system %02d|%s\n", s, escape(stringifier.stringify(systems.get(s)))));
                }
            }
        }
        return out.toString();
    }

    private static String formatToken(Token token) {
        return String.format("%04d|%03d|%s|%s", token.line() + 1, token.column() + 1, token.type(), escape(token.lexeme()));
    }

    private static String escape(String text) {
        return text.replace("\n", "\\n").replace("\t", "\\t");
    }
}
