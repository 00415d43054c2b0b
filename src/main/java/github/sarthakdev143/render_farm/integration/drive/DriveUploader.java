package github.sarthakdev143.render_farm.integration.drive;

import com.google.api.client.http.FileContent;
import com.google.api.services.drive.Drive;
import com.google.api.services.drive.model.File;
import com.google.api.services.drive.model.FileList;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class DriveUploader {

    static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";
    private static final String ROOT_FOLDER_ID = "root";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final Drive driveService;

    public DriveUploader(Drive driveService) {
        this.driveService = driveService;
    }

    /**
     * Uploads a file into a {@code /}-separated folder path under My Drive, creating missing
     * folders. A file with the same name in that folder is overwritten.
     *
     * @return the Drive file id
     */
    public String uploadFile(Path localPath, String remoteFolder) throws IOException {
        String folderId = resolveFolder(remoteFolder);
        String fileName = localPath.getFileName().toString();
        FileContent content = new FileContent(resolveContentType(localPath), localPath.toFile());

        File existing = findChild(folderId, fileName, false);
        if (existing != null) {
            return driveService.files()
                    .update(existing.getId(), new File(), content)
                    .setFields("id")
                    .execute()
                    .getId();
        }

        File metadata = new File()
                .setName(fileName)
                .setParents(List.of(folderId));
        return driveService.files()
                .create(metadata, content)
                .setFields("id")
                .execute()
                .getId();
    }

    String resolveFolder(String remoteFolder) throws IOException {
        String parentId = ROOT_FOLDER_ID;
        if (remoteFolder == null) {
            return parentId;
        }

        for (String segment : remoteFolder.split("/")) {
            if (segment.isBlank()) {
                continue;
            }
            File folder = findChild(parentId, segment, true);
            if (folder == null) {
                File metadata = new File()
                        .setName(segment)
                        .setMimeType(FOLDER_MIME_TYPE)
                        .setParents(List.of(parentId));
                folder = driveService.files().create(metadata).setFields("id").execute();
            }
            parentId = folder.getId();
        }
        return parentId;
    }

    private File findChild(String parentId, String name, boolean folder) throws IOException {
        String query = "name = '" + escape(name) + "'"
                + " and '" + escape(parentId) + "' in parents"
                + " and mimeType " + (folder ? "=" : "!=") + " '" + FOLDER_MIME_TYPE + "'"
                + " and trashed = false";
        FileList result = driveService.files()
                .list()
                .setQ(query)
                .setSpaces("drive")
                .setFields("files(id, name)")
                .execute();
        if (result.getFiles() == null || result.getFiles().isEmpty()) {
            return null;
        }
        return result.getFiles().get(0);
    }

    private String resolveContentType(Path localPath) throws IOException {
        String contentType = Files.probeContentType(localPath);
        return contentType != null ? contentType : DEFAULT_CONTENT_TYPE;
    }

    private String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
