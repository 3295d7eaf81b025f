package com.platform.onboarding.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.onboarding.device.DevicePaths;
import com.platform.onboarding.device.RequestOptions;
import com.platform.onboarding.schema.ConfigClass;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Installs certificate and key material: upload the decoded content,
 * create the certificate or key object from the uploaded file, then
 * remove the temporary file.
 */
public class CertificateInstaller {
    
    /**
     * One step performing the full upload, install and cleanup sequence.
     * Key uploads are silent.
     *
     * @param objectName name of the certificate or key object to create
     * @param fileName name of the uploaded temporary file
     * @param installPath {@link DevicePaths#SSL_CERT} or {@link DevicePaths#SSL_KEY}
     */
    public ApplyStep installStep(ConfigClass owner, String ownerName, String objectName, String fileName,
            String base64, String installPath) {
        String uploadPath = DevicePaths.UPLOADS + "/" + fileName;
        return new ApplyStep(owner, ownerName, uploadPath, client -> {
            String content = new String(Base64.getMimeDecoder().decode(base64), StandardCharsets.UTF_8).trim();
            int size = content.getBytes(StandardCharsets.UTF_8).length;
            RequestOptions uploadOptions = new RequestOptions(fileName.endsWith(".key"), true, Map.of(
                "Content-Type", "application/octet-stream",
                "Content-Range", String.format("0-%d/%d", size - 1, size)));
            client.upload(uploadPath, content, uploadOptions);
            
            ObjectNode install = JsonNodeFactory.instance.objectNode();
            install.put("name", objectName);
            install.put("sourcePath", "file:" + DevicePaths.DOWNLOADS_DIR + "/" + fileName);
            client.createOrModify(installPath, install, RequestOptions.defaults());
            
            ObjectNode remove = JsonNodeFactory.instance.objectNode();
            remove.put("command", "run");
            remove.put("utilCmdArgs", DevicePaths.DOWNLOADS_DIR + "/" + fileName);
            client.create(DevicePaths.UNIX_RM, remove, RequestOptions.defaults());
        });
    }
}
