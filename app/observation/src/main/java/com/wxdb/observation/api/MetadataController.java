/*
 * どこで: Observation API
 * 何を: 観測点メタデータ取り込みのエンドポイントを提供する
 * なぜ: 運用者が任意のタイミングで上流から再取り込みできるようにするため
 */
package com.wxdb.observation.api;

import com.wxdb.observation.service.StationMetadataService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/metadata")
@RequiredArgsConstructor
public class MetadataController {

  private final StationMetadataService stationMetadataService;

  @PostMapping("/cdec/import")
  public MetadataImportResponse importCdec() {
    return stationMetadataService.importCdec();
  }
}
