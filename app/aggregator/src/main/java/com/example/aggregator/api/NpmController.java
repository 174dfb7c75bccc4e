package com.example.aggregator.api;

import com.example.aggregator.api.response.NpmPackage;
import com.example.aggregator.api.response.PackageVersion;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.NpmClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/npm")
@SourceDescription(exampleEndpoint = "/npm/react", description = "Get details of an npm package")
@RequiredArgsConstructor
public class NpmController {

  private final NpmClient npmClient;

  @GetMapping("/{package_name}")
  public ResponseEntity<NpmPackage> packageDetails(
      @PathVariable("package_name") String packageName) {
    return ResponseEntity.ok(npmClient.getPackage(packageName));
  }

  @GetMapping("/{package_name}/latest")
  public ResponseEntity<PackageVersion> latestVersion(
      @PathVariable("package_name") String packageName) {
    return ResponseEntity.ok(npmClient.getLatestVersion(packageName));
  }
}
