package com.filetags.app.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.filetags.app.database.CatalogPaths;
import com.filetags.app.database.CatalogStore;
import com.filetags.app.database.CatalogStore.FileFilter;
import com.filetags.app.database.CatalogStore.FileRow;
import com.filetags.app.database.CatalogStore.RenameOutcome;
import com.filetags.app.database.CatalogStore.RootRow;
import com.filetags.app.database.CatalogStore.TagRow;
import com.filetags.app.database.Database;
import com.filetags.app.inventory.ReconcileListener;
import com.filetags.app.inventory.ReconcileResult;
import com.filetags.app.inventory.Reconciler;
import com.filetags.app.inventory.ScanBusyException;
import com.filetags.app.inventory.ScanCoordinator;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Front end de linha de comando do catálogo. {@link #execute(String[])}
 * devolve 0 (ok), 1 (falha) ou 2 (uso incorreto).
 */
public final class TagCli {

    private static final Logger logger = LoggerFactory.getLogger(TagCli.class);

    private static final DateTimeFormatter WHEN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private TagCli() {}

    public static void main(String[] args) {
        run(args);
    }

    public static void run(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        Command command = Command.find(cmd);
        if (command == Command.HELP) {
            printUsage();
            return 0;
        }
        if (command == null) {
            System.err.println("Comando invalido: " + args[0]);
            printUsage();
            return 2;
        }

        ParseResult parsed = CommandArgs.parse(command, rest);
        if (parsed.help()) {
            printCommandUsage(command);
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printCommandUsage(command);
            return 2;
        }

        try (Database db = Database.open()) {
            CatalogStore store = new CatalogStore(db);
            try (ScanCoordinator scans = new ScanCoordinator(new Reconciler(store))) {
                return dispatch(command, parsed.value(), store, scans);
            }
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            printCommandUsage(command);
            return 2;
        } catch (ScanBusyException e) {
            logger.warn("Pedido \"{}\" recusado; em andamento: {}", e.requestedPurpose(), e.runningPurpose());
            System.err.println(e.getMessage());
            return 1;
        } catch (Exception e) {
            logger.error("Falha no comando {}", cmd, e);
            System.err.println("Erro fatal: " + safeMsg(e));
            return 1;
        }
    }

    private static int dispatch(Command command, CommandArgs a, CatalogStore store, ScanCoordinator scans) {
        return switch (command) {
            case INDEX -> runIndex(a, store, scans);
            case RESCAN_ALL -> runRescanAll(store, scans);
            case ROOTS -> runRoots(store);
            case ADD_ROOT -> runAddRoot(a, store, scans);
            case REMOVE_ROOT -> runRemoveRoot(a, store, scans);
            case LS -> runList(a, store);
            case TAGS -> runTags(store);
            case TAG -> runTag(a, store);
            case UNTAG -> runUntag(a, store);
            case RENAME_TAG -> runRenameTag(a, store);
            case MOVE_TAG -> runMoveTag(a, store);
            case DELETE_TAG -> runDeleteTag(a, store);
            case RENAME_FILE -> runRenameFile(a, store, scans);
            case FORGET -> runForget(a, store);
            case HELP -> 0;
        };
    }

    // ----------------- index / roots -----------------

    private static int runIndex(CommandArgs a, CatalogStore store, ScanCoordinator scans) {
        String root = a.value("--root");
        if (root == null) {
            root = store.getSetting(CatalogStore.SETTING_LAST_ROOT).orElse(null);
            if (root == null) {
                throw new UsageException("Informe --root (nenhuma pasta usada anteriormente).");
            }
        }
        Path dir = requireDirectory(root);
        scans.checkIdle("Indexar " + dir);
        store.setSetting(CatalogStore.SETTING_LAST_ROOT, dir.toString());
        // registra antes: o atalho da reconciliação não cadastra a raiz
        store.addRoot(dir.toString());

        return await(scans.submitReconcile(dir.toString(), new ConsoleProgress()));
    }

    private static int runRescanAll(CatalogStore store, ScanCoordinator scans) {
        List<String> roots = store.listRoots().stream().map(RootRow::path).toList();
        if (roots.isEmpty()) {
            System.out.println("Nenhuma raiz cadastrada.");
            return 0;
        }
        return await(scans.submitReconcileAll(roots, new ConsoleProgress()));
    }

    private static int runRoots(CatalogStore store) {
        List<RootRow> roots = store.listRoots();
        if (roots.isEmpty()) {
            System.out.println("Nenhuma raiz cadastrada.");
            return 0;
        }
        for (RootRow r : roots) {
            System.out.printf("%s | %s%n", formatWhen(r.lastScanned()), r.path());
        }
        return 0;
    }

    private static int runAddRoot(CommandArgs a, CatalogStore store, ScanCoordinator scans) {
        Path dir = requireDirectory(a.value("--root"));
        scans.checkIdle("Adicionar raiz");
        String normalized = store.addRoot(dir.toString());
        System.out.println("Raiz cadastrada: " + normalized);
        return 0;
    }

    private static int runRemoveRoot(CommandArgs a, CatalogStore store, ScanCoordinator scans) {
        scans.checkIdle("Remover raiz");
        int removed = store.removeRoot(a.value("--root"));
        System.out.println("Raiz removida; " + removed + " arquivo(s) saíram do catálogo.");
        return 0;
    }

    private static int await(CompletableFuture<ReconcileResult> future) {
        ReconcileResult result;
        try {
            result = future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            System.err.println("Falha na indexação: " + safeMsg(cause));
            return 1;
        }
        if (result.shortCircuited()) {
            System.out.println("Sem alterações: " + result.total() + " arquivo(s) já indexados.");
        } else {
            System.out.printf("Indexação concluída: %d arquivo(s), %d gravado(s), %d ignorado(s), %d removido(s)%n",
                    result.processed(), result.files().upserted(), result.files().skipped(), result.removed());
        }
        return result.succeeded() ? 0 : 1;
    }

    private static final class ConsoleProgress implements ReconcileListener {
        private int lastPercent = -1;

        @Override
        public void started(long total) {
            System.out.println("Indexando " + total + " arquivo(s)...");
        }

        @Override
        public void progress(long processed, long total) {
            int pct = (int) Math.min(100, processed * 100 / Math.max(1, total));
            if (pct / 10 != lastPercent / 10) {
                lastPercent = pct;
                System.out.printf("  %3d%% (%d/%d)%n", pct, processed, total);
            }
        }
    }

    // ----------------- files -----------------

    private static int runList(CommandArgs a, CatalogStore store) {
        String search = StringUtils.defaultString(a.value("--search"));
        boolean onlyTagged = a.flag("--only-tagged");

        Set<Long> tagIds = new LinkedHashSet<>();
        for (String name : a.values("--tag")) {
            Optional<Long> id = store.findTagId(name);
            if (id.isEmpty()) {
                System.err.println("Tag não encontrada: " + name);
                return 1;
            }
            tagIds.add(id.get());
        }

        FileFilter filter = FileFilter.all()
                .withSearch(search)
                .withTags(tagIds)
                .withOnlyTagged(onlyTagged)
                .withRoot(a.value("--root"));
        List<FileRow> rows = store.listFiles(filter);

        store.setSetting(CatalogStore.SETTING_LAST_SEARCH, search);
        store.setSetting(CatalogStore.SETTING_LAST_ONLY_TAGGED, onlyTagged ? "1" : "0");

        if (a.flag("--json")) {
            System.out.println(toJson(rows, store));
            return 0;
        }
        for (FileRow r : rows) {
            System.out.printf("%10s | %s | %s | %s%n",
                    SizeFormat.explorer(r.size()), formatWhen(r.mtime()), safeText(r.tags()), r.path());
        }
        System.out.println(rows.size() + " arquivo(s)");
        return 0;
    }

    private static int runRenameFile(CommandArgs a, CatalogStore store, ScanCoordinator scans) {
        scans.checkIdle("Renomear arquivo");
        String newPath = store.renameFile(a.value("--file"), a.value("--to"));
        System.out.println("Renomeado para " + newPath);
        return 0;
    }

    private static int runForget(CommandArgs a, CatalogStore store) {
        int n = store.forgetFiles(a.positionals());
        System.out.println(n + " arquivo(s) removido(s) do catálogo.");
        return 0;
    }

    // ----------------- tags -----------------

    private static int runTags(CatalogStore store) {
        List<TagRow> tags = store.listTags();
        if (tags.isEmpty()) {
            System.out.println("Nenhuma tag.");
            return 0;
        }
        Map<Long, Long> counts = store.countFilesByTag();
        for (TagRow t : tags) {
            System.out.printf("%d | %s | %d%n", t.ord(), t.name(), counts.getOrDefault(t.id(), 0L));
        }
        return 0;
    }

    private static int runTag(CommandArgs a, CatalogStore store) {
        long tagId = store.ensureTag(a.value("--name"))
                .orElseThrow(() -> new UsageException("Nome de tag vazio."));

        List<Long> fileIds = new ArrayList<>();
        for (String path : a.positionals()) {
            Optional<FileRow> row = store.findFile(path);
            if (row.isPresent()) {
                fileIds.add(row.get().id());
            } else {
                System.err.println("Fora do catálogo (rode index antes): " + path);
            }
        }
        int added = store.assignTag(fileIds, tagId);
        System.out.println(added + " associação(ões) criada(s).");
        return fileIds.size() == a.positionals().size() ? 0 : 1;
    }

    private static int runUntag(CommandArgs a, CatalogStore store) {
        String path = a.positionals().get(0);
        Optional<FileRow> row = store.findFile(path);
        if (row.isEmpty()) {
            System.err.println("Fora do catálogo: " + path);
            return 1;
        }
        Optional<Long> tagId = store.findTagId(a.value("--name"));
        if (tagId.isEmpty()) {
            System.err.println("Tag não encontrada: " + a.value("--name"));
            return 1;
        }
        int removed = store.untag(row.get().id(), List.of(tagId.get()));
        System.out.println(removed + " associação(ões) removida(s).");
        return 0;
    }

    private static int runRenameTag(CommandArgs a, CatalogStore store) {
        long tagId = requireTag(store, a.value("--name"));
        RenameOutcome outcome = store.renameOrMergeTag(tagId, a.value("--to"));
        switch (outcome) {
            case RENAMED -> System.out.println("Tag renomeada.");
            case MERGED -> System.out.println("Tag unida à tag existente \"" + a.value("--to").trim() + "\".");
            case UNCHANGED -> System.out.println("Nada a fazer.");
        }
        return 0;
    }

    private static int runMoveTag(CommandArgs a, CatalogStore store) {
        boolean up = a.flag("--up");
        boolean down = a.flag("--down");
        if (up == down) {
            throw new UsageException("Use exatamente um de --up ou --down.");
        }
        long tagId = requireTag(store, a.value("--name"));
        boolean moved = store.moveTag(tagId, up ? -1 : 1);
        System.out.println(moved ? "Tag movida." : "Tag já está na ponta.");
        return 0;
    }

    private static int runDeleteTag(CommandArgs a, CatalogStore store) {
        long tagId = requireTag(store, a.value("--name"));
        store.deleteTags(List.of(tagId));
        System.out.println("Tag removida.");
        return 0;
    }

    private static long requireTag(CatalogStore store, String name) {
        return store.findTagId(name)
                .orElseThrow(() -> new IllegalArgumentException("Tag não encontrada: " + name));
    }

    // ----------------- output -----------------

    private static String toJson(List<FileRow> rows, CatalogStore store) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (FileRow r : rows) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id", r.id());
            m.put("path", r.path());
            m.put("size", r.size());
            m.put("sizeText", SizeFormat.explorer(r.size()));
            m.put("mtime", r.mtime());
            m.put("tags", store.listFileTags(r.id()).stream().map(TagRow::name).toList());
            out.add(m);
        }
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            return mapper.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao gerar JSON", e);
        }
    }

    private static String formatWhen(Double epochSeconds) {
        if (epochSeconds == null) return "-";
        Instant instant = Instant.ofEpochMilli(Math.round(epochSeconds * 1000));
        return WHEN.format(LocalDateTime.ofInstant(instant, ZoneId.systemDefault()));
    }

    private static Path requireDirectory(String root) {
        Path dir;
        try {
            dir = Path.of(CatalogPaths.normalize(root));
        } catch (RuntimeException e) {
            throw new UsageException("Caminho invalido: " + safeMsg(e));
        }
        if (!Files.isDirectory(dir)) {
            throw new UsageException("Pasta nao existe: " + dir);
        }
        return dir;
    }

    // ----------------- usage -----------------

    private static void printUsage() {
        System.out.println("""
                FileTags CLI
                Comandos:
                  index [--root <pasta>]
                  rescan-all
                  roots
                  add-root --root <pasta>
                  remove-root --root <pasta>
                  ls [--search <texto>] [--tag <nome>]... [--only-tagged] [--root <pasta>] [--json]
                  tags
                  tag --name <tag> <arquivo>...
                  untag --name <tag> <arquivo>
                  rename-tag --name <tag> --to <novo>
                  move-tag --name <tag> --up|--down
                  delete-tag --name <tag>
                  rename-file --file <arquivo> --to <novo-nome>
                  forget <arquivo>...
                  help
                """);
    }

    private static void printCommandUsage(Command command) {
        System.out.println("Uso:\n  " + command.usage);
    }

    // ----------------- parsing -----------------

    private enum Command {
        INDEX("index", "index [--root <pasta>]", Set.of("--root"), Set.of(), Set.of(), 0, 0),
        RESCAN_ALL("rescan-all", "rescan-all", Set.of(), Set.of(), Set.of(), 0, 0),
        ROOTS("roots", "roots", Set.of(), Set.of(), Set.of(), 0, 0),
        ADD_ROOT("add-root", "add-root --root <pasta>", Set.of("--root"), Set.of(), Set.of("--root"), 0, 0),
        REMOVE_ROOT("remove-root", "remove-root --root <pasta>", Set.of("--root"), Set.of(), Set.of("--root"), 0, 0),
        LS("ls", "ls [--search <texto>] [--tag <nome>]... [--only-tagged] [--root <pasta>] [--json]",
                Set.of("--search", "--tag", "--root"), Set.of("--only-tagged", "--json"), Set.of(), 0, 0),
        TAGS("tags", "tags", Set.of(), Set.of(), Set.of(), 0, 0),
        TAG("tag", "tag --name <tag> <arquivo>...", Set.of("--name"), Set.of(), Set.of("--name"), 1, Integer.MAX_VALUE),
        UNTAG("untag", "untag --name <tag> <arquivo>", Set.of("--name"), Set.of(), Set.of("--name"), 1, 1),
        RENAME_TAG("rename-tag", "rename-tag --name <tag> --to <novo>", Set.of("--name", "--to"), Set.of(),
                Set.of("--name", "--to"), 0, 0),
        MOVE_TAG("move-tag", "move-tag --name <tag> --up|--down", Set.of("--name"), Set.of("--up", "--down"),
                Set.of("--name"), 0, 0),
        DELETE_TAG("delete-tag", "delete-tag --name <tag>", Set.of("--name"), Set.of(), Set.of("--name"), 0, 0),
        RENAME_FILE("rename-file", "rename-file --file <arquivo> --to <novo-nome>", Set.of("--file", "--to"), Set.of(),
                Set.of("--file", "--to"), 0, 0),
        FORGET("forget", "forget <arquivo>...", Set.of(), Set.of(), Set.of(), 1, Integer.MAX_VALUE),
        HELP("help", "help", Set.of(), Set.of(), Set.of(), 0, 0);

        final String label;
        final String usage;
        final Set<String> valueOptions;
        final Set<String> flags;
        final Set<String> required;
        final int minPositionals;
        final int maxPositionals;

        Command(String label, String usage, Set<String> valueOptions, Set<String> flags, Set<String> required,
                int minPositionals, int maxPositionals) {
            this.label = label;
            this.usage = usage;
            this.valueOptions = valueOptions;
            this.flags = flags;
            this.required = required;
            this.minPositionals = minPositionals;
            this.maxPositionals = maxPositionals;
        }

        static Command find(String name) {
            if (name.equals("-h") || name.equals("--help")) return HELP;
            for (Command c : values()) {
                if (c.label.equals(name)) return c;
            }
            return null;
        }
    }

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }
    }

    private record ParseResult(CommandArgs value, boolean help, String error) {
        static ParseResult okResult(CommandArgs v) { return new ParseResult(v, false, null); }
        static ParseResult helpResult() { return new ParseResult(null, true, null); }
        static ParseResult errorResult(String e) { return new ParseResult(null, false, e); }
    }

    private record CommandArgs(Map<String, List<String>> options, Set<String> flagsSet, List<String> positionals) {

        String value(String opt) {
            List<String> v = options.get(opt);
            return v == null || v.isEmpty() ? null : v.get(v.size() - 1);
        }

        List<String> values(String opt) {
            return options.getOrDefault(opt, List.of());
        }

        boolean flag(String opt) {
            return flagsSet.contains(opt);
        }

        static ParseResult parse(Command command, String[] args) {
            Map<String, List<String>> options = new HashMap<>();
            Set<String> flags = new LinkedHashSet<>();
            List<String> positionals = new ArrayList<>();

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    if (t.equals("-h") || t.equals("--help")) {
                        return ParseResult.helpResult();
                    }
                    if (command.valueOptions.contains(t)) {
                        String v = c.requireNext(t);
                        if (isBlank(v)) return ParseResult.errorResult("Valor vazio para " + t);
                        options.computeIfAbsent(t, k -> new ArrayList<>()).add(v);
                    } else if (command.flags.contains(t)) {
                        flags.add(t);
                    } else if (t.startsWith("--")) {
                        return ParseResult.errorResult("Opcao invalida: " + t);
                    } else {
                        positionals.add(t);
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            for (String req : command.required) {
                if (!options.containsKey(req)) {
                    return ParseResult.errorResult("Parametro obrigatorio: " + req);
                }
            }
            if (positionals.size() < command.minPositionals) {
                return ParseResult.errorResult("Informe ao menos " + command.minPositionals + " arquivo(s).");
            }
            if (positionals.size() > command.maxPositionals) {
                return ParseResult.errorResult("Argumento inesperado: " + positionals.get(command.maxPositionals));
            }
            return ParseResult.okResult(new CommandArgs(options, flags, List.copyOf(positionals)));
        }
    }

    /** Erro de uso detectado depois do parse (pasta inexistente, flags conflitantes...). */
    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }

    // ----------------- misc -----------------

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Erro" : t.getClass().getSimpleName())
                : m;
    }

    private static String safeText(String v) {
        return isBlank(v) ? "-" : v;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }
}
