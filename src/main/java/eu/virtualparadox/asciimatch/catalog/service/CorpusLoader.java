package eu.virtualparadox.asciimatch.catalog.service;

import eu.virtualparadox.asciimatch.application.config.ApplicationConfig;
import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads the ASCII art corpus from disk.
 * <p>
 * Steps performed:
 * <ol>
 *     <li>Walks the root directory recursively, in lexical path order</li>
 *     <li>Keeps regular files ending with the configured suffix</li>
 *     <li>Skips files larger than {@code asciimatch.max-blob-bytes}, they would not fit in a message</li>
 *     <li>Assigns sequential ids starting at {@code 0}, in load order</li>
 * </ol>
 * The file name becomes the single tag of an item.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CorpusLoader {

    private final ApplicationConfig props;

    /**
     * @param root corpus directory
     * @return the loaded items, ids {@code 0..n-1}
     * @throws UncheckedIOException if the directory cannot be walked
     */
    public List<AsciiArt> load(final Path root) {
        final List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(props.getFileSuffix()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to walk corpus directory " + root, e);
        }

        final List<AsciiArt> out = new ArrayList<>(files.size());
        for (final Path file : files) {
            final byte[] bytes;
            try {
                final long size = Files.size(file);
                if (size > props.getMaxBlobBytes()) {
                    log.warn("Skipping {}, too big: {}", file, size);
                    continue;
                }
                bytes = read(file);
            } catch (IOException e) {
                log.warn("Skipping {}, unreadable", file, e);
                continue;
            }
            // the file may have grown since it was sized
            if (bytes.length > props.getMaxBlobBytes()) {
                log.warn("Skipping {}, too big: {}", file, bytes.length);
                continue;
            }
            out.add(new AsciiArt(out.size(),
                    new String(bytes, StandardCharsets.UTF_8),
                    List.of(file.getFileName().toString())));
        }

        log.info("Loaded {} of {} files from {}", out.size(), files.size(), root);
        return out;
    }

    byte[] read(final Path file) throws IOException {
        return Files.readAllBytes(file);
    }
}
