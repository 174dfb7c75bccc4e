package com.example.aggregator.api;

import com.example.aggregator.api.response.PackageVersion;
import com.example.aggregator.api.response.PypiPackage;
import com.example.aggregator.routing.SourceDescription;
import com.example.aggregator.service.PypiClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/pypi")
@SourceDescription(
    exampleEndpoint = "/pypi/requests",
    description = "Get details of a PyPI package")
@RequiredArgsConstructor
public class PypiController {

  private final PypiClient pypiClient;

  @GetMapping("/{package_name}")
  public ResponseEntity<PypiPackage> packageDetails(
      @PathVariable("package_name") String packageName) {
    return ResponseEntity.ok(pypiClient.getPackage(packageName));
  }

  @GetMapping("/{package_name}/latest")
  public ResponseEntity<PackageVersion> latestVersion(
      @PathVariable("package_name") String packageName) {
    return ResponseEntity.ok(pypiClient.getLatestVersion(packageName));
  }
}
